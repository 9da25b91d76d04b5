package ca.gc.cra.cblog.domain.event;

import java.util.Objects;

/**
 * The maximum bytes sendable per round trip, logged right after a compact block send.
 *
 * @param timestamp raw timestamp token
 * @param maxSendBytes send allowance per round trip
 * @since 0.1.0
 */
public record WindowSizeLogged(String timestamp, long maxSendBytes) implements CompactBlockEvent {

  /**
   * Validates components.
   */
  public WindowSizeLogged {
    Objects.requireNonNull(timestamp, "timestamp");
  }

  @Override
  public EventKind kind() {
    return EventKind.WINDOW_SIZE_LOGGED;
  }
}
