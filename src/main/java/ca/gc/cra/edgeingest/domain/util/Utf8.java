package ca.gc.cra.edgeingest.domain.util;

import java.nio.charset.StandardCharsets;

/**
 * <strong>What:</strong> Best-effort UTF-8 helpers for raw log bytes.
 * <p><strong>Why:</strong> Firewall logs occasionally carry invalid byte sequences; decoding must substitute
 * rather than fail so a bad line is routed, not fatal.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class Utf8 {
  private Utf8() {}

  /**
   * Decodes a UTF-8 slice, replacing malformed sequences with U+FFFD.
   *
   * @param data backing array; may be {@code null}
   * @param offset starting offset within the array
   * @param length number of bytes to decode
   * @return decoded string or an empty string when inputs are {@code null} or empty
   */
  public static String decode(byte[] data, int offset, int length) {
    if (data == null || length <= 0) {
      return "";
    }
    int start = Math.max(0, Math.min(data.length, offset));
    int len = Math.max(0, Math.min(length, data.length - start));
    if (len == 0) {
      return "";
    }
    // String(byte[], Charset) always substitutes; it never throws on malformed input.
    return new String(data, start, len, StandardCharsets.UTF_8);
  }

  /**
   * Length of {@code text} re-encoded as UTF-8. For text produced by {@link #decode} this counts each
   * substituted U+FFFD as three bytes, so it can exceed the raw length it was decoded from.
   *
   * @param text decoded text; may be {@code null}
   * @return encoded length, {@code 0} for {@code null}
   */
  public static int encodedLength(String text) {
    return text == null ? 0 : text.getBytes(StandardCharsets.UTF_8).length;
  }
}
