package ca.gc.cra.cblog.domain.line;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Assigns each bracketed annotation of a line to a metadata slot.
 * <p><strong>Why:</strong> Annotations are positional and untagged. The rightmost ones (category,
 * optional wallet) are resolved first; the rest are told apart by content shape.</p>
 * <p><strong>Role:</strong> Second stage of {@link LogLineParser}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Resolve {@code category[:level]} and an optional trailing wallet name.</li>
 *   <li>Classify remaining annotations as thread, source location or function, in that order.</li>
 *   <li>Reject unknown shapes and repeated slots with a {@link LogGrammarException}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable after construction; safe for concurrent use.</p>
 * <p><strong>Performance:</strong> Patterns are compiled once per instance.</p>
 *
 * @since 0.1.0
 */
public final class MetadataDisambiguator {
  private static final Pattern SOURCE_LOCATION = Pattern.compile("^([^:]*\\.(?:cpp|h)):(\\d+)$");
  private static final Pattern FUNCTION_NAME =
      Pattern.compile("^(?:[a-zA-Z_][a-zA-Z0-9_]*|operator.+)$");

  private final AnnotationTables tables;
  private final Pattern categoryPattern;

  /**
   * Creates a disambiguator over the supplied vocabulary.
   *
   * @param tables category and thread vocabularies; must not be {@code null}
   */
  public MetadataDisambiguator(AnnotationTables tables) {
    this.tables = Objects.requireNonNull(tables, "tables");
    this.categoryPattern = tables.categoryPattern();
  }

  /**
   * Creates a disambiguator over {@link AnnotationTables#defaults()}.
   */
  public MetadataDisambiguator() {
    this(AnnotationTables.defaults());
  }

  /**
   * Interprets the annotations of a tokenized line.
   *
   * @param tokens tokenizer output; must not be {@code null}
   * @return interpreted metadata
   * @throws MissingCategoryException if a wallet annotation is not preceded by a category
   * @throws UnrecognizedAnnotationException if an annotation has no recognized shape or repeats a slot
   */
  public LogMetadata disambiguate(TokenizedLine tokens) {
    Objects.requireNonNull(tokens, "tokens");
    List<String> remaining = new ArrayList<>(tokens.annotations());
    if (remaining.isEmpty()) {
      return LogMetadata.timestampOnly(tokens.timestamp());
    }
    String line = tokens.line();
    Slots slots = new Slots(line);

    String rightmost = remaining.remove(remaining.size() - 1);
    Matcher category = categoryPattern.matcher(rightmost);
    if (!category.matches()) {
      slots.walletName = rightmost;
      if (remaining.isEmpty()) {
        throw new MissingCategoryException(null, rightmost, line);
      }
      String candidate = remaining.remove(remaining.size() - 1);
      category = categoryPattern.matcher(candidate);
      if (!category.matches()) {
        throw new MissingCategoryException(candidate, rightmost, line);
      }
    }
    slots.category = category.group(1);
    slots.logLevel = category.group(2);

    for (String token : remaining) {
      classifyPositional(token, slots);
    }
    return slots.toMetadata(tokens.timestamp());
  }

  private void classifyPositional(String token, Slots slots) {
    if (tables.isThread(token)) {
      slots.thread = slots.claim("thread", slots.thread, token);
      return;
    }
    Matcher location = SOURCE_LOCATION.matcher(token);
    if (location.matches()) {
      slots.sourceFile = slots.claim("source location", slots.sourceFile, location.group(1));
      slots.sourceLine = parseLineNumber(location.group(2), token, slots.line);
      return;
    }
    if (FUNCTION_NAME.matcher(token).matches()) {
      slots.function = slots.claim("function", slots.function, token);
      return;
    }
    throw new UnrecognizedAnnotationException(token, slots.line);
  }

  private static Integer parseLineNumber(String digits, String token, String line) {
    try {
      return Integer.valueOf(digits);
    } catch (NumberFormatException ex) {
      throw new UnrecognizedAnnotationException(token, line);
    }
  }

  /** Per-line scratch space; each slot may be written once. */
  private static final class Slots {
    private final String line;
    private String category;
    private String logLevel;
    private String thread;
    private String sourceFile;
    private Integer sourceLine;
    private String function;
    private String walletName;

    private Slots(String line) {
      this.line = line;
    }

    private String claim(String slot, String current, String value) {
      if (current != null) {
        throw new UnrecognizedAnnotationException(value, slot, line);
      }
      return value;
    }

    private LogMetadata toMetadata(String timestamp) {
      return new LogMetadata(
          timestamp, category, logLevel, thread, sourceFile, sourceLine, function, walletName);
    }
  }
}
