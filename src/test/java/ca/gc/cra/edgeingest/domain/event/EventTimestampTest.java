package ca.gc.cra.edgeingest.domain.event;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class EventTimestampTest {

  @Test
  void naiveTimestampFormatsWithoutOffset() {
    EventTimestamp ts = new EventTimestamp(LocalDateTime.of(2024, 1, 5, 3, 4, 5), null);

    assertEquals("2024-01-05T03:04:05", ts.toIsoString());
    assertTrue(ts.zoneOffset().isEmpty());
  }

  @Test
  void offsetTimestampFormatsWithColonSeparatedOffset() {
    EventTimestamp ts =
        new EventTimestamp(LocalDateTime.of(2023, 12, 31, 23, 59, 59), ZoneOffset.ofHoursMinutes(5, 30));

    assertEquals("2023-12-31T23:59:59+05:30", ts.toIsoString());
    assertEquals("2023-12-31T23:59:59+00:00",
        new EventTimestamp(LocalDateTime.of(2023, 12, 31, 23, 59, 59), ZoneOffset.UTC).toIsoString());
  }

  @Test
  void subSecondPrecisionIsDropped() {
    EventTimestamp ts = new EventTimestamp(LocalDateTime.of(2024, 1, 5, 3, 4, 5, 999_000_000), null);

    assertEquals(LocalDateTime.of(2024, 1, 5, 3, 4, 5), ts.dateTime());
  }

  @Test
  void dateTimeIsRequired() {
    assertThrows(NullPointerException.class, () -> new EventTimestamp(null, ZoneOffset.UTC));
  }

  @Test
  void codesMatchWireValues() {
    assertEquals("ok", ParseStatus.OK.code());
    assertEquals("partial", ParseStatus.PARTIAL.code());
    assertEquals("kv_parse_exception", DlqReason.KV_PARSE_EXCEPTION.code());
    assertEquals("invalid_month", DlqReason.INVALID_MONTH.code());
  }
}
