package ca.gc.cra.cblog.domain.line;

import java.util.Objects;

/**
 * A parsed log line: interpreted metadata plus the free-text body.
 *
 * @param metadata interpreted annotations; never {@code null}
 * @param body message text after the annotations; never {@code null}
 * @since 0.1.0
 */
public record LogLine(LogMetadata metadata, String body) {

  /**
   * Validates components.
   */
  public LogLine {
    metadata = Objects.requireNonNull(metadata, "metadata");
    body = Objects.requireNonNull(body, "body");
  }

  /**
   * Convenience accessor for the timestamp token.
   *
   * @return timestamp token
   */
  public String timestamp() {
    return metadata.timestamp();
  }
}
