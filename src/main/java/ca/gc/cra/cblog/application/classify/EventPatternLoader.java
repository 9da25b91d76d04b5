package ca.gc.cra.cblog.application.classify;

import ca.gc.cra.cblog.domain.event.EventKind;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads an {@link EventPatternTable} from a YAML document.
 *
 * <pre>
 * version: 1
 * patterns:
 *   - kind: received
 *     category: cmpctblock
 *     regex: 'Initialized PartiallyDownloadedBlock for block (?&lt;blockHash&gt;[0-9a-fA-F]+) using a cmpctblock of (?&lt;compactBlockBytes&gt;\d+) bytes'
 *   - kind: sent
 *     category: net
 *     regex: 'sending cmpctblock \((?&lt;bytes&gt;\d+) bytes\) peer=(?&lt;peerId&gt;\d+)'
 * </pre>
 *
 * @since 0.1.0
 */
public final class EventPatternLoader {

  /**
   * Reads and validates a pattern file.
   *
   * @param path YAML file
   * @return table in file order
   * @throws IOException if the file is missing or unreadable
   * @throws IllegalArgumentException if the document is structurally invalid
   */
  public EventPatternTable load(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    if (!Files.exists(path)) {
      throw new IOException("Pattern file not found: " + path);
    }
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      Object rootObj = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
      if (rootObj == null) {
        throw new IllegalArgumentException("Pattern file is empty: " + path);
      }
      Map<String, Object> root = asMap(rootObj, "root");
      int version = toInt(root.get("version"), "version");
      if (version != 1) {
        throw new IllegalArgumentException("Unsupported pattern version " + version + " in " + path);
      }
      Object patternsNode = root.get("patterns");
      if (!(patternsNode instanceof Iterable<?> iterable)) {
        throw new IllegalArgumentException("patterns must be a list in " + path);
      }
      List<EventPattern> entries = new ArrayList<>();
      for (Object node : iterable) {
        entries.add(parseEntry(asMap(node, "pattern")));
      }
      return new EventPatternTable(entries);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML patterns at " + path, ex);
    }
  }

  private EventPattern parseEntry(Map<String, Object> map) {
    EventKind kind = EventKind.fromString(requireString(map, "kind"));
    String category = requireString(map, "category");
    String regex = requireString(map, "regex");
    return EventPattern.of(kind, category, regex);
  }

  private Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException(context + " contains non-string key");
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  private String requireString(Map<String, Object> map, String key) {
    Object value = map.get(key);
    if (value == null || value.toString().isBlank()) {
      throw new IllegalArgumentException("Missing required field: " + key);
    }
    return value.toString();
  }

  private int toInt(Object value, String context) {
    if (value instanceof Number number) {
      return number.intValue();
    }
    if (value instanceof String str && !str.isBlank()) {
      try {
        return Integer.parseInt(str.trim());
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException("Invalid integer for " + context + ": '" + str + "'");
      }
    }
    throw new IllegalArgumentException("Invalid integer for " + context + ": " + value);
  }
}
