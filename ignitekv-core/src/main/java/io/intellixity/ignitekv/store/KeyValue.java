package io.intellixity.ignitekv.store;

import java.util.Objects;

public record KeyValue(ByteArray key, ByteArray value) {
  public KeyValue {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(value, "value");
  }

  /** Convenience for text keys/values (UTF-8). */
  public static KeyValue of(String key, String value) {
    return new KeyValue(ByteArray.utf8(key), ByteArray.utf8(value));
  }
}
