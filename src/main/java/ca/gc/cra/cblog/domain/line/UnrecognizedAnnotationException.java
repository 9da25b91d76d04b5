package ca.gc.cra.cblog.domain.line;

/**
 * Raised when a bracketed annotation matches none of the recognized shapes, or when it resolves to
 * a slot another annotation on the same line already populated.
 *
 * @since 0.1.0
 */
public final class UnrecognizedAnnotationException extends LogGrammarException {

  /**
   * Creates an exception for an annotation with no recognized shape.
   *
   * @param token offending annotation content
   * @param line full line being parsed
   */
  public UnrecognizedAnnotationException(String token, String line) {
    super("Unrecognized annotation [" + token + "] in line: " + line, token, line);
  }

  /**
   * Creates an exception for an annotation whose slot is already occupied.
   *
   * @param token offending annotation content
   * @param slot metadata slot name that was already populated
   * @param line full line being parsed
   */
  public UnrecognizedAnnotationException(String token, String slot, String line) {
    super("Duplicate " + slot + " annotation [" + token + "] in line: " + line, token, line);
  }
}
