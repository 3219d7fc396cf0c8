package ca.gc.cra.edgeingest.domain.parse;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Scanner for FortiGate {@code key=value} bodies.
 *
 * <p>Grammar, left to right, keys case-sensitive:
 * <ul>
 *   <li>spaces between tokens are skipped;</li>
 *   <li>a key runs up to the next {@code '='} or space and must be followed by {@code '='};</li>
 *   <li>an unquoted value runs up to the next space or the end of the body, and may be empty;</li>
 *   <li>a quoted value starts with {@code '"'}; a backslash emits the following character verbatim and an
 *   unescaped {@code '"'} ends it. An unterminated quote takes the rest of the body.</li>
 * </ul>
 * A token without a bare {@code key=} prefix stops the scan and the rest of the body is dropped. The
 * function is total: it never fails, it only under-parses. A repeated key keeps its last value.</p>
 *
 * @since 0.1.0
 */
public final class KeyValueParser {
  private KeyValueParser() {}

  /**
   * Parses {@code body} into an insertion-ordered map.
   *
   * @param body text after the syslog host
   * @return parsed pairs; possibly empty, never {@code null}
   */
  public static Map<String, String> parse(String body) {
    Map<String, String> out = new LinkedHashMap<>();
    int n = body.length();
    int i = 0;
    while (i < n) {
      i = skipSpaces(body, i);
      if (i >= n) {
        break;
      }

      int keyStart = i;
      while (i < n && body.charAt(i) != '=' && body.charAt(i) != ' ') {
        i++;
      }
      String key = body.substring(keyStart, i);
      if (key.isEmpty() || i >= n || body.charAt(i) != '=') {
        break;
      }
      i++;

      String value;
      if (i < n && body.charAt(i) == '"') {
        i++;
        StringBuilder quoted = new StringBuilder();
        while (i < n) {
          char c = body.charAt(i);
          if (c == '\\' && i + 1 < n) {
            quoted.append(body.charAt(i + 1));
            i += 2;
            continue;
          }
          i++;
          if (c == '"') {
            break;
          }
          quoted.append(c);
        }
        value = quoted.toString();
      } else {
        int valueStart = i;
        while (i < n && body.charAt(i) != ' ') {
          i++;
        }
        value = body.substring(valueStart, i);
      }
      out.put(key, value);
    }
    return out;
  }

  private static int skipSpaces(String body, int from) {
    int i = from;
    while (i < body.length() && body.charAt(i) == ' ') {
      i++;
    }
    return i;
  }
}
