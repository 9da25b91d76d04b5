package ca.gc.cra.cblog.logging;

/**
 * Quotes raw debug-log lines inside diagnostics.
 *
 * <p>A node log line can be very long and may carry carriage returns or other control characters
 * that would break the console layout, so diagnostics quote an escaped excerpt instead of the line
 * itself.</p>
 *
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  private Logs() {
    // Utility
  }

  /**
   * Returns at most {@code maxCodePoints} code points of {@code line} with control characters
   * escaped. A cut line ends with {@code " [+N more]"}, N being the number of dropped code points.
   *
   * @param line raw log line; {@code null} yields {@code "<no line>"}
   * @param maxCodePoints excerpt length; must be positive
   * @return printable excerpt
   * @throws IllegalArgumentException if {@code maxCodePoints} is not positive
   */
  public static String excerpt(String line, int maxCodePoints) {
    if (maxCodePoints <= 0) {
      throw new IllegalArgumentException("maxCodePoints must be positive");
    }
    if (line == null) {
      return "<no line>";
    }
    int total = line.codePointCount(0, line.length());
    int kept = Math.min(total, maxCodePoints);
    int end = line.offsetByCodePoints(0, kept);
    StringBuilder out = new StringBuilder(end + 16);
    line.substring(0, end).codePoints().forEach(cp -> appendEscaped(out, cp));
    if (total > kept) {
      out.append(" [+").append(total - kept).append(" more]");
    }
    return out.toString();
  }

  private static void appendEscaped(StringBuilder out, int cp) {
    switch (cp) {
      case '\t' -> out.append("\\t");
      case '\r' -> out.append("\\r");
      case '\n' -> out.append("\\n");
      default -> {
        if (Character.isISOControl(cp)) {
          out.append(String.format("\\u%04x", cp));
        } else {
          out.appendCodePoint(cp);
        }
      }
    }
  }
}
