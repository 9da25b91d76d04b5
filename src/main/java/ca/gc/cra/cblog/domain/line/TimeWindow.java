package ca.gc.cra.cblog.domain.line;

import java.util.Objects;
import java.util.Optional;

/**
 * Inclusive window over raw timestamp tokens.
 * <p>Timestamps are compared lexically, so bounds must use the same ISO-8601 layout as the log.
 * Either bound may be absent.</p>
 *
 * @param from inclusive lower bound
 * @param to inclusive upper bound
 * @since 0.1.0
 */
public record TimeWindow(Optional<String> from, Optional<String> to) {
  private static final TimeWindow UNBOUNDED = new TimeWindow(Optional.empty(), Optional.empty());

  /**
   * Normalizes blank bounds to absent and rejects inverted windows.
   *
   * @throws IllegalArgumentException if {@code from} sorts after {@code to}
   */
  public TimeWindow {
    from = normalize(from);
    to = normalize(to);
    if (from.isPresent() && to.isPresent() && from.get().compareTo(to.get()) > 0) {
      throw new IllegalArgumentException("from (" + from.get() + ") must not be after to (" + to.get() + ")");
    }
  }

  /**
   * Returns a window that admits every timestamp.
   *
   * @return unbounded window
   */
  public static TimeWindow unbounded() {
    return UNBOUNDED;
  }

  /**
   * Builds a window from possibly blank bounds.
   *
   * @param from lower bound or {@code null}
   * @param to upper bound or {@code null}
   * @return window
   */
  public static TimeWindow of(String from, String to) {
    return new TimeWindow(Optional.ofNullable(from), Optional.ofNullable(to));
  }

  /**
   * Tests whether a timestamp token falls inside the window.
   *
   * @param timestamp raw timestamp token; must not be {@code null}
   * @return {@code true} when {@code from <= timestamp <= to}
   */
  public boolean contains(String timestamp) {
    Objects.requireNonNull(timestamp, "timestamp");
    if (from.isPresent() && timestamp.compareTo(from.get()) < 0) {
      return false;
    }
    return to.isEmpty() || timestamp.compareTo(to.get()) <= 0;
  }

  /**
   * Indicates whether neither bound is set.
   *
   * @return {@code true} for the unbounded window
   */
  public boolean isUnbounded() {
    return from.isEmpty() && to.isEmpty();
  }

  private static Optional<String> normalize(Optional<String> bound) {
    if (bound == null) {
      return Optional.empty();
    }
    return bound.map(String::trim).filter(value -> !value.isEmpty());
  }
}
