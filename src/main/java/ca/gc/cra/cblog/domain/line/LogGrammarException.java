package ca.gc.cra.cblog.domain.line;

/**
 * <strong>What:</strong> Base type for structural violations of the log annotation grammar.
 * <p><strong>Why:</strong> The annotation grammar is treated as closed; a shape the parser does not
 * recognize means either a new annotation kind or a tokenizer defect, so the run must stop.</p>
 * <p><strong>Role:</strong> Fatal domain error surfaced by {@link MetadataDisambiguator}.</p>
 * <p><strong>Thread-safety:</strong> Immutable after construction.</p>
 *
 * @since 0.1.0
 * @see UnrecognizedAnnotationException
 * @see MissingCategoryException
 */
public abstract class LogGrammarException extends RuntimeException {
  private final String token;
  private final String line;

  /**
   * Creates a grammar violation describing the offending token and line.
   *
   * @param message human-readable description
   * @param token annotation content that triggered the failure
   * @param line full line being parsed
   */
  protected LogGrammarException(String message, String token, String line) {
    super(message);
    this.token = token;
    this.line = line;
  }

  /**
   * Returns the annotation content (outer brackets stripped) that triggered the failure.
   *
   * @return offending token
   */
  public String token() {
    return token;
  }

  /**
   * Returns the full log line that was being parsed.
   *
   * @return offending line
   */
  public String line() {
    return line;
  }
}
