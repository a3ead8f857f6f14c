package io.intellixity.ignitekv.store;

import java.util.Objects;

/** One entry of a {@link KeyValueStore#batch(java.util.List)} request. */
public sealed interface WriteOp permits WriteOp.Put, WriteOp.Delete {
  ByteArray key();

  static WriteOp put(ByteArray key, ByteArray value) {
    return new Put(key, value);
  }

  static WriteOp delete(ByteArray key) {
    return new Delete(key);
  }

  record Put(ByteArray key, ByteArray value) implements WriteOp {
    public Put {
      Objects.requireNonNull(key, "key");
      Objects.requireNonNull(value, "value");
    }
  }

  record Delete(ByteArray key) implements WriteOp {
    public Delete {
      Objects.requireNonNull(key, "key");
    }
  }
}
