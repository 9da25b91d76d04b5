package ca.gc.cra.cblog.domain.line;

import java.util.Objects;

/**
 * <strong>What:</strong> Interpreted annotations of one log line.
 * <p><strong>Why:</strong> Downstream classification dispatches on {@code category}; the remaining
 * slots are kept so tools can filter or report on them without re-parsing.</p>
 * <p><strong>Role:</strong> Domain value object produced by {@link MetadataDisambiguator}.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * <p>Every slot other than {@code timestamp} may be {@code null}. A level never appears without a
 * category.</p>
 *
 * @param timestamp unparsed, lexically sortable timestamp token; never {@code null}
 * @param category log category such as {@code net} or {@code cmpctblock}
 * @param logLevel level suffix of the category annotation ({@code debug}, {@code info}, ...)
 * @param thread emitting thread name
 * @param sourceFile source path of the emitting statement
 * @param sourceLine source line number; present exactly when {@code sourceFile} is present
 * @param function emitting function name
 * @param walletName wallet name annotation
 * @since 0.1.0
 */
public record LogMetadata(
    String timestamp,
    String category,
    String logLevel,
    String thread,
    String sourceFile,
    Integer sourceLine,
    String function,
    String walletName) {

  /**
   * Validates slot invariants.
   *
   * @throws IllegalArgumentException if a level is supplied without a category, or a source line
   *     without a source file
   */
  public LogMetadata {
    timestamp = Objects.requireNonNull(timestamp, "timestamp");
    if (logLevel != null && category == null) {
      throw new IllegalArgumentException("logLevel requires a category");
    }
    if ((sourceFile == null) != (sourceLine == null)) {
      throw new IllegalArgumentException("sourceFile and sourceLine must be set together");
    }
  }

  /**
   * Creates metadata for a line that carries no annotations.
   *
   * @param timestamp timestamp token
   * @return metadata with every optional slot absent
   */
  public static LogMetadata timestampOnly(String timestamp) {
    return new LogMetadata(timestamp, null, null, null, null, null, null, null);
  }


  /**
   * Indicates whether any annotation slot was populated.
   *
   * @return {@code true} when at least one optional slot is present
   */
  public boolean hasAnnotations() {
    return category != null
        || thread != null
        || sourceFile != null
        || function != null
        || walletName != null;
  }
}
