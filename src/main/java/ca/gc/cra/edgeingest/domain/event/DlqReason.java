package ca.gc.cra.edgeingest.domain.event;

/**
 * Reason codes attached to dead-lettered lines, in the order the parser evaluates them.
 *
 * @since 0.1.0
 */
public enum DlqReason {
  /** Line is empty once its trailing line feed is removed. */
  EMPTY_LINE("empty_line"),
  /** Line carries a NUL byte or more than five control characters. */
  NON_TEXT_OR_BINARY("non_text_or_binary"),
  /** Line does not match {@code <Mon> <day> <HH:MM:SS> <host> <body>}. */
  SYSLOG_HEADER_PARSE_FAIL("syslog_header_parse_fail"),
  /** Month token is not one of the twelve English abbreviations. */
  INVALID_MONTH("invalid_month"),
  /** Key/value scanning faulted internally. */
  KV_PARSE_EXCEPTION("kv_parse_exception");

  private final String code;

  DlqReason(String code) {
    this.code = code;
  }

  /**
   * Returns the wire code written to the dead-letter sink.
   *
   * @return snake_case reason code
   */
  public String code() {
    return code;
  }
}
