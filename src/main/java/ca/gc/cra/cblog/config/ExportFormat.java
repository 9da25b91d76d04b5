package ca.gc.cra.cblog.config;

import java.util.Locale;

/**
 * <strong>What:</strong> File formats available for exporting the received and sent tables.
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ExportFormat {
  /** Comma-separated values with a header row. */
  CSV,
  /** One JSON object per line. */
  NDJSON;

  /**
   * Parses a string into an {@link ExportFormat}, defaulting to {@link #CSV} when blank.
   *
   * @param value textual representation such as {@code "csv"} or {@code "ndjson"}
   * @return parsed format
   * @throws IllegalArgumentException if the string does not match a known format
   */
  public static ExportFormat fromString(String value) {
    if (value == null || value.isBlank()) {
      return CSV;
    }
    try {
      return ExportFormat.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unknown format: " + value + " (expected csv or ndjson)", ex);
    }
  }
}
