package ca.gc.cra.cblog.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Layers built-in defaults, the YAML file and command-line options into one option map, then
 * checks the options that only make sense together.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Command-line options win over YAML, which wins over {@code defaults}.
   *
   * @param mode command being configured
   * @param yaml options read from the {@code config=} file, if any
   * @param cli command-line options; {@code null} entries are skipped
   * @param defaults built-in options for {@code mode}
   * @param warn receives one message per YAML value replaced by a different command-line value
   * @return immutable effective options
   * @throws IllegalArgumentException if {@code from} sorts after {@code to}, a filter run lacks a
   *     bound, or {@code format} names no export format
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Map<String, String> fromFile = Objects.requireNonNull(yaml, "yaml").orElse(Map.of());
    Consumer<String> warnings = warn == null ? message -> {} : warn;

    Map<String, String> effective = new LinkedHashMap<>();
    if (defaults != null) {
      effective.putAll(defaults);
    }
    effective.putAll(fromFile);
    if (cli != null) {
      cli.forEach((key, value) -> {
        if (key == null || value == null) {
          return;
        }
        String replaced = fromFile.get(key);
        if (replaced != null && !replaced.equals(value)) {
          warnings.accept("CLI overrides YAML for key: " + key);
        }
        effective.put(key, value);
      });
    }

    checkWindow(mode, text(effective, "from"), text(effective, "to"));
    String format = text(effective, "format");
    if (!format.isEmpty()) {
      ExportFormat.fromString(format);
    }
    return Map.copyOf(effective);
  }

  private static void checkWindow(String mode, String from, String to) {
    boolean bounded = !from.isEmpty() && !to.isEmpty();
    if (bounded && from.compareTo(to) > 0) {
      throw new IllegalArgumentException("from (" + from + ") must not be after to (" + to + ")");
    }
    if (!bounded && "filter".equalsIgnoreCase(mode)) {
      throw new IllegalArgumentException("filter requires both from and to");
    }
  }

  private static String text(Map<String, String> options, String key) {
    String value = options.get(key);
    return value == null ? "" : value.trim();
  }
}
