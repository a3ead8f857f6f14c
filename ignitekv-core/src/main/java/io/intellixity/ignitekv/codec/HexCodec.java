package io.intellixity.ignitekv.codec;

import io.intellixity.ignitekv.store.ByteArray;

import java.util.HexFormat;
import java.util.Objects;

/**
 * Lowercase hex encoding.\n
 *
 * '0'-'9' sort before 'a'-'f' in ordinal comparison, so encoded keys keep the unsigned byte order.
 * Trailing blanks (CHAR column padding) are dropped on decode; hex never produces a blank.
 */
public final class HexCodec implements Codec {
  public static final HexCodec INSTANCE = new HexCodec();

  private static final HexFormat HEX = HexFormat.of();

  private HexCodec() {}

  @Override public String id() { return "hex"; }

  @Override
  public String encode(ByteArray bytes) {
    Objects.requireNonNull(bytes, "bytes");
    return HEX.formatHex(bytes.toByteArray());
  }

  @Override
  public ByteArray decode(String text) {
    Objects.requireNonNull(text, "text");
    int end = text.length();
    while (end > 0 && text.charAt(end - 1) == ' ') end--;
    String hex = text.substring(0, end);
    if ((hex.length() & 1) != 0) {
      throw new IllegalStateException("Corrupt hex value (odd length " + hex.length() + ")");
    }
    try {
      return ByteArray.copyOf(HEX.parseHex(hex));
    } catch (IllegalArgumentException e) {
      throw new IllegalStateException("Corrupt hex value in backing table", e);
    }
  }

  @Override
  public int encodedLength(int byteLength) {
    return byteLength * 2;
  }
}
