package io.intellixity.ignitekv.store;

/**
 * A statement failed after the retry bound was exhausted, or failed with a non-retryable
 * integrity-constraint violation.
 */
public final class BackendException extends KvStoreException {
  private final int attempts;
  private final boolean constraintViolation;

  public BackendException(String message, Throwable cause, int attempts, boolean constraintViolation) {
    super(message, cause);
    this.attempts = attempts;
    this.constraintViolation = constraintViolation;
  }

  public BackendException(String message, Throwable cause, int attempts) {
    this(message, cause, attempts, false);
  }

  /** Number of attempts made before giving up. */
  public int attempts() {
    return attempts;
  }

  /** True if the backend rejected the statement with an integrity-constraint violation (SQLState 23xxx). */
  public boolean isConstraintViolation() {
    return constraintViolation;
  }
}
