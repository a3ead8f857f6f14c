package io.intellixity.ignitekv.store;

/** An operation ran before {@code open} completed or after {@code close}. */
public final class NotInitializedException extends KvStoreException {
  public NotInitializedException(String message) {
    super(message);
  }
}
