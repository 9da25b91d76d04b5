package ca.gc.cra.cblog.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Built-in options of each command, the lowest layer merged by {@link ConfigMerger}.
 */
public final class DefaultsForMode {
  private static final Map<String, String> SHARED = Map.of(
      "from", "",
      "to", "",
      "patterns", "",
      "verbose", "false",
      "metricsExporter", "none",
      "otelEndpoint", "",
      "otelResourceAttributes", "");

  private static final Map<String, Map<String, String>> BY_MODE = Map.of(
      "parse", Map.of(
          "out", ParseConfig.DEFAULT_OUTPUT,
          "format", ExportFormat.CSV.name().toLowerCase(Locale.ROOT),
          "dryRun", "false",
          "allowOverwrite", "false"),
      "stats", Map.of(),
      "filter", Map.of());

  private DefaultsForMode() {}

  /**
   * @param mode parse, stats or filter, case-insensitive
   * @return unmodifiable defaults for {@code mode}
   * @throws IllegalArgumentException for any other mode
   */
  public static Map<String, String> asFlatMap(String mode) {
    String key = Objects.requireNonNull(mode, "mode").trim().toLowerCase(Locale.ROOT);
    Map<String, String> specific = BY_MODE.get(key);
    if (specific == null) {
      throw new IllegalArgumentException("Unsupported mode: " + mode);
    }
    Map<String, String> defaults = new LinkedHashMap<>(SHARED);
    defaults.putAll(specific);
    return Map.copyOf(defaults);
  }
}
