package ca.gc.cra.cblog.domain.event;

import java.util.Objects;

/**
 * A compact block message of {@code bytes} was sent to {@code peerId}. The block hash is not logged.
 *
 * @param timestamp raw timestamp token
 * @param peerId numeric peer identifier
 * @param bytes serialized message size
 * @since 0.1.0
 */
public record CompactBlockSent(String timestamp, long peerId, long bytes) implements CompactBlockEvent {

  /**
   * Validates components.
   */
  public CompactBlockSent {
    Objects.requireNonNull(timestamp, "timestamp");
  }

  @Override
  public EventKind kind() {
    return EventKind.SENT;
  }
}
