package ca.gc.cra.cblog.config;

import ca.gc.cra.cblog.domain.line.TimeWindow;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Configuration for the {@code parse} command, which correlates a log and
 * exports the received and sent tables.
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param input log file to read
 * @param outputDirectory directory receiving {@code received.*} and {@code sent.*}
 * @param format export file format
 * @param window inclusive timestamp window applied before annotation parsing
 * @param patterns optional event pattern file replacing the built-in table
 * @since 0.1.0
 * @see InputConfig
 */
public record ParseConfig(
    Path input,
    Path outputDirectory,
    ExportFormat format,
    TimeWindow window,
    Optional<Path> patterns) {

  static final String DEFAULT_OUTPUT = "cblog-out";

  /**
   * Normalizes optional components.
   *
   * @throws NullPointerException if {@code input} or {@code outputDirectory} is {@code null}
   */
  public ParseConfig {
    Objects.requireNonNull(input, "input");
    Objects.requireNonNull(outputDirectory, "outputDirectory");
    format = Objects.requireNonNullElse(format, ExportFormat.CSV);
    window = Objects.requireNonNullElse(window, TimeWindow.unbounded());
    patterns = Objects.requireNonNullElse(patterns, Optional.empty());
  }

  /**
   * Creates a configuration from CLI-style key/value pairs.
   *
   * @param options keys {@code in}, {@code out}, {@code format}, {@code from}, {@code to}, {@code patterns}
   * @return populated configuration
   * @throws IllegalArgumentException when {@code in} is missing or a value is invalid
   */
  public static ParseConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    Path output = ConfigValues.optionalPath(options, "out")
        .orElseGet(() -> ConfigValues.parsePath("out", DEFAULT_OUTPUT));
    return new ParseConfig(
        ConfigValues.requirePath(options, "in"),
        output,
        ExportFormat.fromString(options.get("format")),
        TimeWindow.of(options.get("from"), options.get("to")),
        ConfigValues.optionalPath(options, "patterns"));
  }
}
