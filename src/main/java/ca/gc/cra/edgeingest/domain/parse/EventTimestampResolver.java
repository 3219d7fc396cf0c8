package ca.gc.cra.edgeingest.domain.parse;

import ca.gc.cra.edgeingest.domain.event.EventTimestamp;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.ResolverStyle;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Resolves the event time of a FortiGate line.
 *
 * <p>Order: explicit {@code date}+{@code time} keys, then the contextual year combined with the envelope's
 * month/day/time. A {@code tz} key of the form {@code [+-]HHMM} is applied to whichever path succeeds; any
 * other {@code tz}, or one beyond +/-18:00, leaves the result offset-naive. When neither path produces a valid date-time the result
 * is empty, which is not a parse failure.</p>
 *
 * @since 0.1.0
 */
public final class EventTimestampResolver {
  private static final Pattern TZ = Pattern.compile("[+-]\\d{4}");
  private static final DateTimeFormatter DATE =
      DateTimeFormatter.ofPattern("uuuu-MM-dd").withResolverStyle(ResolverStyle.STRICT);
  private static final DateTimeFormatter TIME =
      DateTimeFormatter.ofPattern("HH:mm:ss").withResolverStyle(ResolverStyle.STRICT);

  private EventTimestampResolver() {}

  /**
   * Resolves the timestamp.
   *
   * @param kv parsed body pairs
   * @param contextualYear year assumed for the envelope date, which carries none
   * @param envelopeMonth envelope month {@code 1..12}
   * @param envelopeDay envelope day of month as written
   * @param envelopeTime envelope {@code HH:MM:SS} as written
   * @return resolved timestamp, or empty when no valid date-time could be built
   */
  public static Optional<EventTimestamp> resolve(
      Map<String, String> kv,
      int contextualYear,
      int envelopeMonth,
      int envelopeDay,
      String envelopeTime) {
    String tz = normalizedTz(kv.get("tz"));

    Optional<EventTimestamp> explicit = fromKeys(kv.get("date"), kv.get("time"), tz);
    if (explicit.isPresent()) {
      return explicit;
    }

    try {
      LocalTime envelope = LocalTime.parse(envelopeTime, TIME);
      LocalDateTime fallback = LocalDateTime.of(
          LocalDate.of(contextualYear, envelopeMonth, envelopeDay), envelope);
      return Optional.of(withTz(fallback, tz));
    } catch (DateTimeException ex) {
      return Optional.empty();
    }
  }

  private static Optional<EventTimestamp> fromKeys(String date, String time, String tz) {
    if (date == null || date.isEmpty() || time == null || time.isEmpty()) {
      return Optional.empty();
    }
    try {
      LocalDateTime explicit = LocalDateTime.of(LocalDate.parse(date, DATE), LocalTime.parse(time, TIME));
      return Optional.of(withTz(explicit, tz));
    } catch (DateTimeException ex) {
      return Optional.empty();
    }
  }

  private static EventTimestamp withTz(LocalDateTime dateTime, String tz) {
    if (tz == null) {
      return new EventTimestamp(dateTime, null);
    }
    int sign = tz.charAt(0) == '-' ? -1 : 1;
    int hours = Integer.parseInt(tz.substring(1, 3));
    int minutes = Integer.parseInt(tz.substring(3, 5));
    // Minutes above 59 carry into hours, so +0099 is +01:39.
    int totalSeconds = sign * (hours * 3600 + minutes * 60);
    try {
      return new EventTimestamp(dateTime, ZoneOffset.ofTotalSeconds(totalSeconds));
    } catch (DateTimeException ex) {
      // Beyond +/-18:00 no ZoneOffset exists; keep the wall-clock time without one.
      return new EventTimestamp(dateTime, null);
    }
  }

  private static String normalizedTz(String raw) {
    if (raw == null || raw.isEmpty()) {
      return null;
    }
    String cleaned = stripQuotes(raw.strip());
    return TZ.matcher(cleaned).matches() ? cleaned : null;
  }

  private static String stripQuotes(String value) {
    int start = 0;
    int end = value.length();
    while (start < end && value.charAt(start) == '"') {
      start++;
    }
    while (end > start && value.charAt(end - 1) == '"') {
      end--;
    }
    return value.substring(start, end);
  }
}
