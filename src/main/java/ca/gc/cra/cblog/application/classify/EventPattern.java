package ca.gc.cra.cblog.application.classify;

import ca.gc.cra.cblog.domain.event.EventKind;
import ca.gc.cra.cblog.validation.Strings;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * One entry of the classifier's pattern table: a category bucket plus a body pattern whose named
 * groups supply the fields of {@code kind}.
 *
 * <p>The pattern is applied with {@link Matcher#lookingAt()}, so it is anchored at the start of the
 * body but may leave trailing text unmatched.</p>
 *
 * @param kind event produced on match
 * @param category category the line must carry
 * @param pattern body pattern declaring every group in {@link #requiredGroups(EventKind)}
 * @since 0.1.0
 */
public record EventPattern(EventKind kind, String category, Pattern pattern) {
  private static final Pattern NAMED_GROUP = Pattern.compile("\\(\\?<([a-zA-Z][a-zA-Z0-9]*)>");

  /**
   * Validates that the pattern declares the groups its kind needs.
   *
   * @throws IllegalArgumentException if the category is blank or a required group is missing
   */
  public EventPattern {
    Objects.requireNonNull(kind, "kind");
    category = Strings.requireNonBlank("category", category);
    Objects.requireNonNull(pattern, "pattern");
    Set<String> declared = declaredGroups(pattern);
    for (String group : requiredGroups(kind)) {
      if (!declared.contains(group)) {
        throw new IllegalArgumentException(
            "pattern for " + kind + " must declare named group '" + group + "': " + pattern.pattern());
      }
    }
  }

  /**
   * Compiles {@code regex} into a pattern entry.
   *
   * @param kind event kind
   * @param category required category
   * @param regex body regular expression
   * @return validated entry
   * @throws IllegalArgumentException if the regex does not compile or lacks a required group
   */
  public static EventPattern of(EventKind kind, String category, String regex) {
    Strings.requireNonBlank("regex", regex);
    try {
      return new EventPattern(kind, category, Pattern.compile(regex));
    } catch (PatternSyntaxException ex) {
      throw new IllegalArgumentException("Invalid regex for " + kind + ": " + ex.getDescription(), ex);
    }
  }

  /**
   * Names of the capture groups each kind reads.
   *
   * @param kind event kind
   * @return ordered group names
   */
  public static List<String> requiredGroups(EventKind kind) {
    return switch (kind) {
      case RECEIVED -> List.of("blockHash", "compactBlockBytes");
      case RECONSTRUCTED -> List.of(
          "blockHash", "prefilledCount", "mempoolCount", "extraPoolCount", "requestedCount", "requestedBytes");
      case ANNOUNCED, REQUESTED -> List.of("blockHash", "peerId");
      case SENT -> List.of("bytes", "peerId");
      case WINDOW_SIZE_LOGGED -> List.of("maxSendBytes");
    };
  }

  /**
   * Applies the pattern to a message body.
   *
   * @param body message body
   * @return matcher positioned on a successful prefix match, or {@code null} when the body does not match
   */
  Matcher match(String body) {
    Matcher matcher = pattern.matcher(body);
    return matcher.lookingAt() ? matcher : null;
  }

  private static Set<String> declaredGroups(Pattern pattern) {
    Set<String> names = new LinkedHashSet<>();
    Matcher matcher = NAMED_GROUP.matcher(pattern.pattern());
    while (matcher.find()) {
      names.add(matcher.group(1));
    }
    return names;
  }
}
