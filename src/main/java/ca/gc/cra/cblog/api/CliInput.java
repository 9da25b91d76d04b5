package ca.gc.cra.cblog.api;

import ca.gc.cra.cblog.validation.Strings;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Arguments of one cblog command, split into {@code name=value} options and {@code --switches}.
 *
 * <p>Splitting never fails. Malformed options are reported by {@link #options()} and unknown
 * switches are kept in {@link #unrecognized()} so each command can decide how to reject them after
 * it has had the chance to print help.</p>
 *
 * @param assignments option tokens in command-line order
 * @param switches recognised switches
 * @param unrecognized dash-prefixed tokens that name no known switch, lower-cased
 * @since 0.1.0
 */
public record CliInput(List<String> assignments, Set<Switch> switches, List<String> unrecognized) {
  private static final Pattern OPTION_NAME = Pattern.compile("[A-Za-z][A-Za-z0-9._-]*");

  /** Switches understood by every command. */
  public enum Switch {
    HELP("--help", "-h", "help"),
    VERBOSE("--verbose", "-v", "--debug"),
    DRY_RUN("--dry-run"),
    ALLOW_OVERWRITE("--allow-overwrite");

    private final List<String> spellings;

    Switch(String... spellings) {
      this.spellings = List.of(spellings);
    }

    static Optional<Switch> lookup(String token) {
      String lower = token.toLowerCase(Locale.ROOT);
      for (Switch candidate : values()) {
        if (candidate.spellings.contains(lower)) {
          return Optional.of(candidate);
        }
      }
      return Optional.empty();
    }

    /** Canonical spelling shown in help and error messages. */
    public String spelling() {
      return spellings.get(0);
    }
  }

  public CliInput {
    assignments = List.copyOf(assignments);
    switches = switches.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(switches));
    unrecognized = List.copyOf(unrecognized);
  }

  /**
   * Splits raw arguments. Blank and {@code null} tokens are dropped.
   *
   * @param args raw CLI arguments; may be {@code null}
   * @return split arguments
   */
  public static CliInput parse(String[] args) {
    List<String> assignments = new ArrayList<>();
    Set<Switch> switches = EnumSet.noneOf(Switch.class);
    List<String> unrecognized = new ArrayList<>();
    if (args != null) {
      for (String raw : args) {
        String token = raw == null ? "" : raw.trim();
        if (token.isEmpty()) {
          continue;
        }
        Optional<Switch> known = Switch.lookup(token);
        if (known.isPresent()) {
          switches.add(known.get());
        } else if (token.startsWith("-") && token.indexOf('=') < 0) {
          unrecognized.add(token.toLowerCase(Locale.ROOT));
        } else {
          assignments.add(token);
        }
      }
    }
    return new CliInput(assignments, switches, unrecognized);
  }

  /**
   * Builds the option map. The value is everything after the first {@code '='}, so timestamps such
   * as {@code from=2024-05-01T10:00:00Z} survive intact.
   *
   * @return mutable map in command-line order
   * @throws IllegalArgumentException if a token is not {@code name=value}, a name is invalid, a
   *     value is blank or carries control characters, or the same option is given twice
   */
  public Map<String, String> options() {
    Map<String, String> options = new LinkedHashMap<>();
    for (String token : assignments) {
      int eq = token.indexOf('=');
      if (eq < 0) {
        throw new IllegalArgumentException("expected name=value but got '" + token + "'");
      }
      String name = token.substring(0, eq).trim();
      if (!OPTION_NAME.matcher(name).matches()) {
        throw new IllegalArgumentException("invalid option name '" + name + "'");
      }
      String value = Strings.requireNonBlank(name, token.substring(eq + 1));
      if (options.putIfAbsent(name, value) != null) {
        throw new IllegalArgumentException("option " + name + " given more than once");
      }
    }
    return options;
  }

  public boolean has(Switch flag) {
    return switches.contains(flag);
  }

  public boolean help() {
    return has(Switch.HELP);
  }

  public boolean verbose() {
    return has(Switch.VERBOSE);
  }
}
