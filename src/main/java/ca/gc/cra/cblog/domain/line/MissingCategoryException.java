package ca.gc.cra.cblog.domain.line;

/**
 * Raised when the rightmost annotation was read as a wallet name but no valid category annotation
 * precedes it.
 *
 * @since 0.1.0
 */
public final class MissingCategoryException extends LogGrammarException {

  /**
   * Creates an exception for a wallet annotation without a preceding category.
   *
   * @param token annotation found where a category was required; {@code null} when none remained
   * @param walletName annotation that was interpreted as the wallet name
   * @param line full line being parsed
   */
  public MissingCategoryException(String token, String walletName, String line) {
    super(
        token == null
            ? "Wallet annotation [" + walletName + "] has no preceding category in line: " + line
            : "Expected a log category before wallet annotation [" + walletName + "] but found ["
                + token + "] in line: " + line,
        token,
        line);
  }
}
