package ca.gc.cra.edgeingest.logging;

import java.nio.charset.StandardCharsets;

/**
 * <strong>What:</strong> Helpers that make raw firewall lines safe to print in operator logs.
 * <p><strong>Why:</strong> Dead-lettered lines may be huge or full of control bytes; logging them verbatim would
 * corrupt terminals and flood log files.</p>
 * <p><strong>Thread-safety:</strong> Stateless utilities safe for concurrent use.</p>
 *
 * @implNote Truncation backs off to the start of a UTF-8 sequence so no partial code point is emitted.
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  /** Byte budget applied to raw lines quoted in log messages. */
  public static final int RAW_LINE_BUDGET = 256;

  private static final String NULL_PLACEHOLDER = "<null>";

  private Logs() {
    // Utility
  }

  /**
   * Truncates a string to the requested UTF-8 byte length, appending the original length.
   *
   * @param value string to truncate; {@code null} results in {@code "<null>"}
   * @param maxBytes maximum number of bytes to retain; must be positive
   * @return truncated string when the input exceeds {@code maxBytes}; otherwise the original value
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    if (bytes.length <= maxBytes) {
      return value;
    }
    int end = maxBytes;
    while (end > 0 && (bytes[end] & 0xC0) == 0x80) {
      end--;
    }
    return new String(bytes, 0, end, StandardCharsets.UTF_8)
        + "... (truncated, " + maxBytes + " of " + bytes.length + " bytes)";
  }

  /**
   * Escapes control characters (including the line feed) and truncates to {@link #RAW_LINE_BUDGET}.
   *
   * @param rawLine line as read from a log file
   * @return single-line printable rendition
   */
  public static String printable(String rawLine) {
    if (rawLine == null) {
      return NULL_PLACEHOLDER;
    }
    StringBuilder out = new StringBuilder(Math.min(rawLine.length(), RAW_LINE_BUDGET) + 16);
    for (int i = 0; i < rawLine.length(); i++) {
      char c = rawLine.charAt(i);
      switch (c) {
        case '\n' -> out.append("\\n");
        case '\r' -> out.append("\\r");
        case '\t' -> out.append("\\t");
        default -> {
          if (Character.isISOControl(c)) {
            out.append(String.format("\\x%02x", (int) c));
          } else {
            out.append(c);
          }
        }
      }
    }
    return truncate(out.toString(), RAW_LINE_BUDGET);
  }
}
