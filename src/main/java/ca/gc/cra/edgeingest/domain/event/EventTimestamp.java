package ca.gc.cra.edgeingest.domain.event;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolved event time: a local date-time with an optional fixed UTC offset.
 *
 * <p>Offset-naive timestamps are kept naive; the agent does not guess the firewall's zone.</p>
 *
 * @param dateTime wall-clock date and time at second precision
 * @param offset fixed offset from a {@code tz} key; {@code null} when the timestamp is offset-naive
 * @since 0.1.0
 */
public record EventTimestamp(LocalDateTime dateTime, ZoneOffset offset) {
  private static final DateTimeFormatter LOCAL = DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss");
  private static final DateTimeFormatter WITH_OFFSET =
      DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ssxxx");

  public EventTimestamp {
    Objects.requireNonNull(dateTime, "dateTime");
    dateTime = dateTime.withNano(0);
  }

  public Optional<ZoneOffset> zoneOffset() {
    return Optional.ofNullable(offset);
  }

  /**
   * Formats as ISO-8601, e.g. {@code 2024-01-05T03:04:05} or {@code 2023-12-31T23:59:59+05:30}.
   *
   * @return ISO-8601 text
   */
  public String toIsoString() {
    if (offset == null) {
      return LOCAL.format(dateTime);
    }
    return WITH_OFFSET.format(dateTime.atOffset(offset));
  }

  @Override
  public String toString() {
    return toIsoString();
  }
}
