package ca.gc.cra.cblog.validation;

import java.util.Objects;

/**
 * Checks on text from the command line, YAML files and event pattern tables.
 *
 * @since 0.1.0
 * @see Paths
 */
public final class Strings {

  private Strings() {
    // Utility
  }

  /**
   * @param name option or field name used in the error message
   * @param value text to check
   * @return {@code value} trimmed
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if it is blank or contains an ISO control character
   */
  public static String requireNonBlank(String name, String value) {
    Objects.requireNonNull(value, label(name));
    if (value.codePoints().anyMatch(Character::isISOControl)) {
      throw new IllegalArgumentException(label(name) + " must not contain control characters");
    }
    String trimmed = value.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(label(name) + " must not be blank");
    }
    return trimmed;
  }

  /**
   * Like {@link #requireNonBlank} but also limits the value to {@code maxLength} characters in the
   * range {@code 0x20-0x7E}, as OTLP resource attributes require.
   *
   * @throws IllegalArgumentException if {@code maxLength} is negative or the value breaks a rule
   */
  public static String requirePrintableAscii(String name, String value, int maxLength) {
    if (maxLength < 0) {
      throw new IllegalArgumentException("maxLength must be >= 0");
    }
    String trimmed = requireNonBlank(name, value);
    if (trimmed.length() > maxLength) {
      throw new IllegalArgumentException(label(name) + " length must be <= " + maxLength);
    }
    if (trimmed.chars().anyMatch(c -> c < 0x20 || c > 0x7E)) {
      throw new IllegalArgumentException(label(name) + " must contain printable ASCII characters");
    }
    return trimmed;
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
