package ca.gc.cra.edgeingest.domain.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Content digests used for stable event identifiers.
 *
 * @since 0.1.0
 */
public final class Hashes {
  private static final int EVENT_ID_BYTES = 16;

  private Hashes() {}

  /**
   * Computes the SHA-256 of the UTF-8 encoding of {@code value}, truncated to 128 bits.
   *
   * @param value text to digest; must not be {@code null}
   * @return 32 lower-case hexadecimal characters
   */
  public static String sha256Prefix128Hex(CharSequence value) {
    return sha256Prefix128Hex(value.toString().getBytes(StandardCharsets.UTF_8));
  }

  /**
   * Computes the SHA-256 of {@code data}, truncated to 128 bits.
   *
   * @param data bytes to digest
   * @return 32 lower-case hexadecimal characters
   */
  public static String sha256Prefix128Hex(byte[] data) {
    byte[] digest = sha256().digest(data);
    return HexFormat.of().formatHex(digest, 0, EVENT_ID_BYTES);
  }

  private static MessageDigest sha256() {
    try {
      return MessageDigest.getInstance("SHA-256");
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 not available in this JVM", ex);
    }
  }
}
