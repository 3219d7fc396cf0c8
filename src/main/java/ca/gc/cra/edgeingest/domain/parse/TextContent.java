package ca.gc.cra.edgeingest.domain.parse;

/**
 * Heuristic for lines that are binary garbage rather than log text.
 *
 * @since 0.1.0
 */
public final class TextContent {
  /** More control characters than this marks a line as binary. */
  static final int MAX_CONTROL_CHARS = 5;

  private TextContent() {}

  /**
   * Flags lines carrying a NUL, or more than {@value #MAX_CONTROL_CHARS} control characters below tab or in
   * {@code 11..31}. Tab and line feed are text.
   *
   * @param line line without its trailing line feed
   * @return {@code true} when the line should be dead-lettered as binary
   */
  public static boolean looksBinary(CharSequence line) {
    int control = 0;
    for (int i = 0; i < line.length(); i++) {
      char c = line.charAt(i);
      if (c == '\0') {
        return true;
      }
      if (c < 9 || (c >= 11 && c < 32)) {
        control++;
        if (control > MAX_CONTROL_CHARS) {
          return true;
        }
      }
    }
    return false;
  }
}
