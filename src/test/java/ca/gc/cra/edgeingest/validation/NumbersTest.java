package ca.gc.cra.edgeingest.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void requireRangeIsInclusive() {
    assertEquals(1L, Numbers.requireRange("poll", 1, 1, 10));
    assertEquals(10L, Numbers.requireRange("poll", 10, 1, 10));

    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("poll", 11, 1, 10));
    assertEquals("poll must be between 1 and 10 (was 11)", ex.getMessage());
  }

  @Test
  void parseInRangeTrimsAndValidates() {
    assertEquals(2024L, Numbers.parseInRange("year", " 2024 ", 1970, 9999));

    IllegalArgumentException notNumber =
        assertThrows(IllegalArgumentException.class, () -> Numbers.parseInRange("year", "20x4", 1970, 9999));
    assertTrue(notNumber.getMessage().contains("must be an integer"));
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseInRange("year", "", 1970, 9999));
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseInRange("year", "1969", 1970, 9999));
  }
}
