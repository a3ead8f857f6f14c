package io.intellixity.ignitekv.codec;

import io.intellixity.ignitekv.store.ByteArray;

/**
 * Reversible mapping between store bytes and the text stored in the backing table.\n
 *
 * Implementations must preserve order: for any {@code a}, {@code b},
 * {@code a.compareTo(b)} and {@code encode(a).compareTo(encode(b))} have the same sign.
 * The choice of codec is part of the table's data format and must not change once written.
 */
public interface Codec {
  String id();

  String encode(ByteArray bytes);

  ByteArray decode(String text);

  /** Encoded length, in characters, of a byte string of the given length. */
  int encodedLength(int byteLength);
}
