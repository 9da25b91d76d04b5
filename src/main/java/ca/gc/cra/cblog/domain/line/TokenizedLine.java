package ca.gc.cra.cblog.domain.line;

import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Positional split of a raw log line before annotations are interpreted.
 * <p><strong>Role:</strong> Output of {@link LineTokenizer}; input of {@link MetadataDisambiguator}.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; annotation list is defensively copied.</p>
 *
 * @param timestamp text before the first whitespace run; never {@code null}
 * @param metadataPrefix raw text between the timestamp separator and the body, including brackets
 *     and whitespace; never {@code null}, may be empty
 * @param annotations bracket group contents in line order with outer brackets stripped
 * @param body free text after the metadata prefix; never {@code null}, may be empty
 * @param line original line, kept for diagnostics
 * @since 0.1.0
 */
public record TokenizedLine(
    String timestamp,
    String metadataPrefix,
    List<String> annotations,
    String body,
    String line) {

  /**
   * Validates components and copies the annotation list.
   */
  public TokenizedLine {
    timestamp = Objects.requireNonNull(timestamp, "timestamp");
    metadataPrefix = Objects.requireNonNull(metadataPrefix, "metadataPrefix");
    annotations = annotations == null ? List.of() : List.copyOf(annotations);
    body = Objects.requireNonNull(body, "body");
    line = Objects.requireNonNull(line, "line");
  }
}
