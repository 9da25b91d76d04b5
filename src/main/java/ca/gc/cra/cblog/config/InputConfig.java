package ca.gc.cra.cblog.config;

import ca.gc.cra.cblog.domain.line.TimeWindow;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Configuration shared by the read-only {@code stats} and {@code filter} commands.
 *
 * @param input log file to read
 * @param window inclusive timestamp window; unbounded when neither {@code from} nor {@code to} is set
 * @param patterns optional event pattern file replacing the built-in table
 * @since 0.1.0
 */
public record InputConfig(Path input, TimeWindow window, Optional<Path> patterns) {

  /**
   * Validates required components.
   *
   * @throws NullPointerException if any component is {@code null}
   */
  public InputConfig {
    Objects.requireNonNull(input, "input");
    window = Objects.requireNonNullElse(window, TimeWindow.unbounded());
    patterns = Objects.requireNonNullElse(patterns, Optional.empty());
  }

  /**
   * Creates a configuration from CLI-style key/value pairs ({@code in}, {@code from}, {@code to},
   * {@code patterns}).
   *
   * @param options merged configuration map
   * @return populated configuration
   * @throws IllegalArgumentException if {@code in} is missing or the window is inverted
   */
  public static InputConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    return new InputConfig(
        ConfigValues.requirePath(options, "in"),
        TimeWindow.of(options.get("from"), options.get("to")),
        ConfigValues.optionalPath(options, "patterns"));
  }
}
