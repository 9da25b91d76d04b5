package ca.gc.cra.cblog.domain.line;

/**
 * Checked exception raised when a log line has no separable timestamp token.
 * <p>Recoverable: pipelines report the line and continue with the next one.</p>
 *
 * @since 0.1.0
 */
public final class MalformedLineException extends Exception {
  private final String line;

  /**
   * Creates an exception for the offending line.
   *
   * @param line raw line that could not be split
   */
  public MalformedLineException(String line) {
    super("Malformed log line (no timestamp separator): " + line);
    this.line = line;
  }

  /**
   * Returns the raw line that failed to tokenize.
   *
   * @return offending line
   */
  public String line() {
    return line;
  }
}
