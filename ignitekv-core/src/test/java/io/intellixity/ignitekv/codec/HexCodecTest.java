package io.intellixity.ignitekv.codec;

import io.intellixity.ignitekv.store.ByteArray;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

final class HexCodecTest {
  private final HexCodec codec = HexCodec.INSTANCE;

  @Test
  void roundTripsArbitraryBytes() {
    Random rnd = new Random(42);
    for (int len = 0; len <= 128; len++) {
      byte[] b = new byte[len];
      rnd.nextBytes(b);
      ByteArray x = ByteArray.copyOf(b);
      assertEquals(x, codec.decode(codec.encode(x)), "len=" + len);
    }
  }

  @Test
  void encodesLowercaseHex() {
    assertEquals("00ff7f80", codec.encode(ByteArray.of((byte) 0x00, (byte) 0xff, (byte) 0x7f, (byte) 0x80)));
    assertEquals("", codec.encode(ByteArray.empty()));
  }

  @Test
  void encodingPreservesUnsignedByteOrder() {
    Random rnd = new Random(7);
    for (int i = 0; i < 2_000; i++) {
      ByteArray a = random(rnd);
      ByteArray b = random(rnd);
      int expected = Integer.signum(a.compareTo(b));
      int actual = Integer.signum(codec.encode(a).compareTo(codec.encode(b)));
      assertEquals(expected, actual, a + " vs " + b);
    }
  }

  @Test
  void decodeStripsCharPadding() {
    assertEquals(ByteArray.utf8("a"), codec.decode("61    "));
  }

  @Test
  void decodeRejectsCorruptText() {
    assertThrows(IllegalStateException.class, () -> codec.decode("abc"));
    assertThrows(IllegalStateException.class, () -> codec.decode("zz"));
  }

  private static ByteArray random(Random rnd) {
    byte[] b = new byte[rnd.nextInt(6)];
    rnd.nextBytes(b);
    return ByteArray.copyOf(b);
  }
}
