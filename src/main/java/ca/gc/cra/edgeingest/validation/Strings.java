package ca.gc.cra.edgeingest.validation;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * String validation helpers for configuration values.
 *
 * @since 0.1.0
 */
public final class Strings {
  private static final Pattern FILE_TOKEN_PATTERN = Pattern.compile("^([A-Za-z0-9._-]+)$");

  private Strings() {
    // Utility
  }

  /**
   * Trims and validates a required string.
   *
   * @param name parameter name used in diagnostics
   * @param value candidate value
   * @return trimmed value
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the value is blank or contains control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Validates a token embedded in generated file names, such as a sink prefix.
   *
   * @param name parameter name used in diagnostics
   * @param value candidate token
   * @return trimmed token
   * @throws IllegalArgumentException if the token is blank or contains characters other than letters,
   *     digits, dot, underscore or hyphen
   */
  public static String sanitizeFileToken(String name, String value) {
    String sanitized = requireNonBlank(name, value);
    if (!FILE_TOKEN_PATTERN.matcher(sanitized).matches()) {
      throw new IllegalArgumentException(message(name,
          "must only contain letters, digits, dot, underscore, or hyphen"));
    }
    return sanitized;
  }

  /**
   * Validates a bounded printable-ASCII value such as an OpenTelemetry resource attribute list.
   *
   * @param name parameter name used in diagnostics
   * @param value candidate value
   * @param maxLength maximum accepted length
   * @return trimmed value
   * @throws IllegalArgumentException if the value is blank, too long or contains non-printable characters
   */
  public static String requirePrintableAscii(String name, String value, int maxLength) {
    String trimmed = requireNonBlank(name, value);
    if (trimmed.length() > maxLength) {
      throw new IllegalArgumentException(message(name, "must be at most " + maxLength + " characters"));
    }
    for (int i = 0; i < trimmed.length(); i++) {
      char c = trimmed.charAt(i);
      if (c < 0x20 || c > 0x7e) {
        throw new IllegalArgumentException(message(name, "must contain printable ASCII only"));
      }
    }
    return trimmed;
  }

  static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
