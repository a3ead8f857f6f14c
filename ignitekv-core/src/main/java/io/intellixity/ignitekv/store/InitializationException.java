package io.intellixity.ignitekv.store;

/** Connecting to the backend or bootstrapping the backing table failed. */
public final class InitializationException extends KvStoreException {
  public InitializationException(String message) {
    super(message);
  }

  public InitializationException(String message, Throwable cause) {
    super(message, cause);
  }
}
