package ca.gc.cra.cblog.config;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/** Shared parsing helpers for the typed configuration records. */
final class ConfigValues {
  private ConfigValues() {}

  static Optional<String> optionalString(Map<String, String> options, String key) {
    String value = options.get(key);
    if (value == null) {
      return Optional.empty();
    }
    String trimmed = value.trim();
    return trimmed.isEmpty() ? Optional.empty() : Optional.of(trimmed);
  }

  static Path requirePath(Map<String, String> options, String key) {
    return optionalString(options, key)
        .map(value -> parsePath(key, value))
        .orElseThrow(() -> new IllegalArgumentException(key + " is required"));
  }

  static Optional<Path> optionalPath(Map<String, String> options, String key) {
    return optionalString(options, key).map(value -> parsePath(key, value));
  }

  static Path parsePath(String key, String value) {
    try {
      return Path.of(value).toAbsolutePath().normalize();
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(key + " is not a valid path: " + value, ex);
    }
  }
}
