package io.intellixity.ignitekv.store;

public final class NotFoundException extends KvStoreException {
  private final ByteArray key;

  public NotFoundException(ByteArray key) {
    super("NotFound: " + key);
    this.key = key;
  }

  public ByteArray key() {
    return key;
  }
}
