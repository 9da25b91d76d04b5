package ca.gc.cra.cblog.domain.line;

import java.util.ArrayList;
import java.util.List;

/**
 * <strong>What:</strong> Splits a raw log line into timestamp, bracketed annotations and body.
 * <p><strong>Why:</strong> Annotations carry no explicit tags, so the body can only be separated by
 * position: everything after the longest leading run of {@code [...]} groups is body text.</p>
 * <p><strong>Role:</strong> Leaf of the line parsing chain ({@link LogLineParser}).</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Separate the timestamp token on the first whitespace run.</li>
 *   <li>Greedily consume non-empty bracket groups interleaved with whitespace.</li>
 *   <li>Keep the raw metadata prefix so a line can be reassembled verbatim.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 * <p><strong>Performance:</strong> Single left-to-right scan, O(n) in the line length.</p>
 *
 * @implNote A body that itself starts with bracket-shaped text ({@code [x] payload}) is consumed as
 *     metadata. The format cannot tell the two apart and the longest prefix wins.
 * @since 0.1.0
 */
public final class LineTokenizer {

  private LineTokenizer() {
    // Utility
  }

  /**
   * Tokenizes one trimmed, non-empty line.
   *
   * @param line raw line; leading and trailing whitespace is ignored
   * @return positional split of the line
   * @throws MalformedLineException if the line has no whitespace separating a timestamp
   * @throws NullPointerException if {@code line} is {@code null}
   */
  public static TokenizedLine tokenize(String line) throws MalformedLineException {
    String trimmed = line.strip();
    int separator = indexOfWhitespace(trimmed);
    if (separator <= 0) {
      throw new MalformedLineException(line);
    }
    String timestamp = trimmed.substring(0, separator);
    int prefixStart = separator + 1;

    List<String> annotations = new ArrayList<>();
    int cursor = skipWhitespace(trimmed, prefixStart);
    while (cursor < trimmed.length() && trimmed.charAt(cursor) == '[') {
      int close = trimmed.indexOf(']', cursor + 1);
      if (close < 0 || close == cursor + 1) {
        // unterminated or empty group: the body starts here
        break;
      }
      annotations.add(trimmed.substring(cursor + 1, close));
      cursor = skipWhitespace(trimmed, close + 1);
    }

    String prefix = trimmed.substring(prefixStart, cursor);
    String body = trimmed.substring(cursor);
    return new TokenizedLine(timestamp, prefix, annotations, body, trimmed);
  }

  private static int indexOfWhitespace(String value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isWhitespace(value.charAt(i))) {
        return i;
      }
    }
    return -1;
  }

  private static int skipWhitespace(String value, int from) {
    int i = from;
    while (i < value.length() && Character.isWhitespace(value.charAt(i))) {
      i++;
    }
    return i;
  }
}
