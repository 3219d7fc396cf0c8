package ca.gc.cra.edgeingest.domain.event;

/**
 * Outcome quality of a successfully parsed line.
 *
 * @since 0.1.0
 */
public enum ParseStatus {
  /** {@code type}, {@code subtype} and {@code action} were all present. */
  OK("ok"),
  /** The line parsed but at least one of {@code type}, {@code subtype}, {@code action} was missing. */
  PARTIAL("partial");

  private final String code;

  ParseStatus(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }
}
