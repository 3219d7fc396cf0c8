package ca.gc.cra.edgeingest.domain.parse;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * BSD-syslog style envelope: {@code <Mon> <day> <HH:MM:SS> <host> <body>}.
 *
 * @param month capitalized three-letter month token as written (not yet validated)
 * @param day day of month, one or two digits
 * @param time {@code HH:MM:SS} as written (not yet range checked)
 * @param host single non-whitespace host token
 * @param body remainder of the line after the host
 * @since 0.1.0
 */
public record SyslogEnvelope(String month, int day, String time, String host, String body) {
  private static final Pattern ENVELOPE = Pattern.compile(
      "^(?<mon>[A-Z][a-z]{2})\\s+(?<day>\\d{1,2})\\s+(?<time>\\d{2}:\\d{2}:\\d{2})\\s+(?<host>\\S+)\\s+(?<body>.*)$",
      Pattern.DOTALL);

  private static final Map<String, Integer> MONTHS = Map.ofEntries(
      Map.entry("Jan", 1), Map.entry("Feb", 2), Map.entry("Mar", 3), Map.entry("Apr", 4),
      Map.entry("May", 5), Map.entry("Jun", 6), Map.entry("Jul", 7), Map.entry("Aug", 8),
      Map.entry("Sep", 9), Map.entry("Oct", 10), Map.entry("Nov", 11), Map.entry("Dec", 12));

  public SyslogEnvelope {
    Objects.requireNonNull(month, "month");
    Objects.requireNonNull(time, "time");
    Objects.requireNonNull(host, "host");
    Objects.requireNonNull(body, "body");
  }

  /**
   * Matches the envelope grammar.
   *
   * @param line line without its trailing line feed
   * @return envelope, or empty when the line does not match
   */
  public static Optional<SyslogEnvelope> match(String line) {
    Matcher m = ENVELOPE.matcher(line);
    if (!m.matches()) {
      return Optional.empty();
    }
    return Optional.of(new SyslogEnvelope(
        m.group("mon"),
        Integer.parseInt(m.group("day")),
        m.group("time"),
        m.group("host"),
        m.group("body")));
  }

  /**
   * Resolves the month token against the English abbreviations.
   *
   * @return month number {@code 1..12}, or empty for tokens such as {@code Foo}
   */
  public OptionalInt monthNumber() {
    Integer value = MONTHS.get(month);
    return value == null ? OptionalInt.empty() : OptionalInt.of(value);
  }
}
