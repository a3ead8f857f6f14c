package io.intellixity.ignitekv.store;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/** Immutable byte string ordered by unsigned lexicographic comparison (the store's key order). */
public final class ByteArray implements Comparable<ByteArray> {
  private static final ByteArray EMPTY = new ByteArray(new byte[0]);

  private final byte[] data;

  private ByteArray(byte[] data) {
    this.data = data;
  }

  public static ByteArray copyOf(byte[] bytes) {
    Objects.requireNonNull(bytes, "bytes");
    if (bytes.length == 0) return EMPTY;
    return new ByteArray(bytes.clone());
  }

  public static ByteArray of(byte... bytes) {
    return copyOf(bytes);
  }

  /** UTF-8 bytes of the given text. */
  public static ByteArray utf8(String text) {
    Objects.requireNonNull(text, "text");
    if (text.isEmpty()) return EMPTY;
    return new ByteArray(text.getBytes(StandardCharsets.UTF_8));
  }

  public static ByteArray empty() {
    return EMPTY;
  }

  public int length() {
    return data.length;
  }

  public boolean isEmpty() {
    return data.length == 0;
  }

  public byte[] toByteArray() {
    return data.clone();
  }

  public String toUtf8() {
    return new String(data, StandardCharsets.UTF_8);
  }

  @Override
  public int compareTo(ByteArray other) {
    return Arrays.compareUnsigned(data, other.data);
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof ByteArray other && Arrays.equals(data, other.data);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(data);
  }

  @Override
  public String toString() {
    if (data.length == 0) return "ByteArray[]";
    String hex = HexFormat.of().formatHex(data);
    if (hex.length() > 32) {
      return "ByteArray[" + hex.substring(0, 32) + "... (" + data.length + " bytes)]";
    }
    return "ByteArray[" + hex + "]";
  }
}
