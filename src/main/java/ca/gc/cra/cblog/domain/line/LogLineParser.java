package ca.gc.cra.cblog.domain.line;

import java.util.Objects;

/**
 * Tokenizes and disambiguates raw log lines into {@link LogLine}s.
 * <p>Stateless apart from the immutable {@link MetadataDisambiguator}; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class LogLineParser {
  private final MetadataDisambiguator disambiguator;

  /**
   * Creates a parser backed by the supplied disambiguator.
   *
   * @param disambiguator annotation interpreter; must not be {@code null}
   */
  public LogLineParser(MetadataDisambiguator disambiguator) {
    this.disambiguator = Objects.requireNonNull(disambiguator, "disambiguator");
  }

  /**
   * Creates a parser using the default annotation vocabulary.
   */
  public LogLineParser() {
    this(new MetadataDisambiguator());
  }

  /**
   * Splits a line without interpreting its annotations.
   *
   * @param line raw line
   * @return positional split
   * @throws MalformedLineException if no timestamp can be separated
   */
  public TokenizedLine tokenize(String line) throws MalformedLineException {
    return LineTokenizer.tokenize(line);
  }

  /**
   * Interprets the annotations of an already tokenized line.
   *
   * @param tokens tokenizer output
   * @return parsed line
   * @throws LogGrammarException if an annotation violates the grammar
   */
  public LogLine interpret(TokenizedLine tokens) {
    return new LogLine(disambiguator.disambiguate(tokens), tokens.body());
  }

  /**
   * Parses a raw line end to end.
   *
   * @param line raw line
   * @return parsed line
   * @throws MalformedLineException if no timestamp can be separated
   * @throws LogGrammarException if an annotation violates the grammar
   */
  public LogLine parse(String line) throws MalformedLineException {
    return interpret(tokenize(line));
  }
}
