package ca.gc.cra.cblog.domain.event;

import java.util.Locale;

/**
 * <strong>What:</strong> Closed set of compact-block relay events recognized in node logs.
 * <p><strong>Role:</strong> Discriminator for {@link CompactBlockEvent} and key of pattern table entries.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum EventKind {
  /** A compact block arrived and partial download state was initialized. */
  RECEIVED,
  /** A partially downloaded block was rebuilt from the mempool and requested transactions. */
  RECONSTRUCTED,
  /** The node announced a new block to a peer with a compact block. */
  ANNOUNCED,
  /** A peer asked for a block as a compact block via getdata. */
  REQUESTED,
  /** A compact block message was written to a peer. */
  SENT,
  /** The per round-trip send allowance in effect for the last send. */
  WINDOW_SIZE_LOGGED;

  /**
   * Parses a kind name case-insensitively; dashes are accepted in place of underscores.
   *
   * @param value textual kind such as {@code received} or {@code window-size-logged}
   * @return parsed kind
   * @throws IllegalArgumentException if the name is blank or unknown
   */
  public static EventKind fromString(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("event kind must not be blank");
    }
    try {
      return EventKind.valueOf(value.trim().replace('-', '_').toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unknown event kind: " + value, ex);
    }
  }

  /**
   * Returns the dotted metric suffix for this kind.
   *
   * @return lower-case name, e.g. {@code window_size_logged}
   */
  public String metricName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
