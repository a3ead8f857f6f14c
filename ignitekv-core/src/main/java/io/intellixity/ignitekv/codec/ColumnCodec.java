package io.intellixity.ignitekv.codec;

import io.intellixity.ignitekv.store.ByteArray;
import io.intellixity.ignitekv.store.ValueTooLargeException;

import java.util.Objects;

/** A {@link Codec} bound to one fixed-width column; rejects values that would not fit. */
public final class ColumnCodec {
  private final String column;
  private final int width;
  private final Codec codec;

  public ColumnCodec(String column, int width, Codec codec) {
    if (width <= 0) throw new IllegalArgumentException("width must be > 0");
    this.column = Objects.requireNonNull(column, "column");
    this.width = width;
    this.codec = Objects.requireNonNull(codec, "codec");
  }

  public String column() { return column; }
  public int width() { return width; }

  /** Largest byte length that still fits the column. */
  public int maxBytes() {
    int n = 0;
    while (codec.encodedLength(n + 1) <= width) n++;
    return n;
  }

  /** Encodes a stored key or value, enforcing the column width. */
  public String encode(ByteArray bytes) {
    Objects.requireNonNull(bytes, column);
    int len = codec.encodedLength(bytes.length());
    if (len > width) throw new ValueTooLargeException(column, len, width);
    return codec.encode(bytes);
  }

  /** Encodes a comparison operand (range bound); no width check. */
  public String encodeOperand(ByteArray bytes) {
    return codec.encode(Objects.requireNonNull(bytes, column));
  }

  public ByteArray decode(String text) {
    return codec.decode(text);
  }
}
