package ca.gc.cra.cblog.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads the optional {@code config=} YAML file of a cblog command.
 *
 * <p>Layout:</p>
 * <pre>
 * common:            # applies to every command
 *   patterns: events.yaml
 *   window:
 *     from: "2024-05-01T10:00:00Z"
 *     to: "2024-05-01T11:00:00Z"
 *   metrics:
 *     exporter: otlp
 *     endpoint: http://collector:4317
 *     resourceAttributes: deployment.environment=lab
 * parse:             # one section per command, overriding common
 *   out: ./cblog-out
 *   format: ndjson
 * </pre>
 *
 * <p>The {@code window} and {@code metrics} groups map onto the same option names the command line
 * uses ({@code from}, {@code to}, {@code metricsExporter}, {@code otelEndpoint},
 * {@code otelResourceAttributes}). Timestamps must be quoted: an unquoted
 * {@code 2024-05-01} would be read as a date and lose the text compared against log lines.</p>
 */
public final class YamlConfigLoader {
  private static final String COMMON = "common";
  private static final Set<String> SECTIONS = Set.of(COMMON, "parse", "stats", "filter");
  private static final Map<String, Map<String, String>> GROUPS = Map.of(
      "window", Map.of("from", "from", "to", "to"),
      "metrics", Map.of(
          "exporter", "metricsExporter",
          "endpoint", "otelEndpoint",
          "resourceAttributes", "otelResourceAttributes"));

  private YamlConfigLoader() {}

  /**
   * Returns the options of {@code common} overlaid with those of the {@code mode} section.
   *
   * @param path YAML file
   * @param mode command name, case-insensitive
   * @return options, empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException on malformed YAML, an unknown section or group, a list value
   *     or an unquoted timestamp
   */
  public static Optional<Map<String, String>> load(Path path, String mode) throws IOException {
    Objects.requireNonNull(path, "path");
    String section = Objects.requireNonNull(mode, "mode").trim().toLowerCase(Locale.ROOT);
    if (!Files.exists(path)) {
      return Optional.empty();
    }

    Object document;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
    if (document == null) {
      return Optional.of(Map.of());
    }

    Map<String, Object> sections = mapping(document, "document");
    for (String name : sections.keySet()) {
      if (!SECTIONS.contains(name.toLowerCase(Locale.ROOT))) {
        throw new IllegalArgumentException(
            "unknown section '" + name + "'; expected common, parse, stats or filter");
      }
    }
    Map<String, String> options = new LinkedHashMap<>();
    readSection(sections, COMMON, options);
    readSection(sections, section, options);
    return Optional.of(Map.copyOf(options));
  }

  private static void readSection(Map<String, Object> sections, String name, Map<String, String> options) {
    for (Map.Entry<String, Object> section : sections.entrySet()) {
      if (!section.getKey().toLowerCase(Locale.ROOT).equals(name) || section.getValue() == null) {
        continue;
      }
      for (Map.Entry<String, Object> entry : mapping(section.getValue(), name).entrySet()) {
        String key = entry.getKey();
        Object value = entry.getValue();
        if (value instanceof Map<?, ?> nested) {
          readGroup(name, key, mapping(nested, name + "." + key), options);
        } else {
          options.put(key, scalar(name + "." + key, value));
        }
      }
    }
  }

  private static void readGroup(String section, String group, Map<String, Object> values, Map<String, String> options) {
    Map<String, String> names = GROUPS.get(group);
    if (names == null) {
      throw new IllegalArgumentException(
          "unknown group '" + group + "' in section " + section + "; expected window or metrics");
    }
    for (Map.Entry<String, Object> entry : values.entrySet()) {
      String option = names.get(entry.getKey());
      if (option == null) {
        throw new IllegalArgumentException(
            "unknown key '" + entry.getKey() + "' in " + section + "." + group);
      }
      options.put(option, scalar(section + "." + group + "." + entry.getKey(), entry.getValue()));
    }
  }

  private static String scalar(String path, Object value) {
    if (value == null) {
      return "";
    }
    if (value instanceof Date) {
      throw new IllegalArgumentException(path + " was read as a YAML date; quote the timestamp");
    }
    if (value instanceof Iterable<?> || value instanceof Map<?, ?>) {
      throw new IllegalArgumentException(path + " must be a single value");
    }
    return value.toString();
  }

  private static Map<String, Object> mapping(Object node, String where) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(where + " must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    raw.forEach((key, value) -> {
      if (!(key instanceof String name) || name.isBlank()) {
        throw new IllegalArgumentException(where + " has a blank or non-text key: " + key);
      }
      map.put(name.trim(), value);
    });
    return map;
  }
}
