package ca.gc.cra.edgeingest.domain.util;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class Utf8Test {

  @Test
  void invalidByteDecodesToReplacementCharacter() {
    byte[] raw = {'a', (byte) 0xFF, '\n'};

    String text = Utf8.decode(raw, 0, raw.length);

    assertEquals("a�\n", text);
    assertEquals(5, Utf8.encodedLength(text));
  }

  @Test
  void encodedLengthOfNullIsZero() {
    assertEquals(0, Utf8.encodedLength(null));
  }
}
