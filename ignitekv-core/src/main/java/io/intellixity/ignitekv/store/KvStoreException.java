package io.intellixity.ignitekv.store;

/** Base type of the errors a {@link KeyValueStore} raises. */
public abstract class KvStoreException extends RuntimeException {
  protected KvStoreException(String message) {
    super(message);
  }

  protected KvStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
