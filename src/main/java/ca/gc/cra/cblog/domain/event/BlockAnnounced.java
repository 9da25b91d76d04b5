package ca.gc.cra.cblog.domain.event;

import java.util.Objects;

/**
 * The node is about to announce {@code blockHash} to {@code peerId} with a compact block.
 *
 * @param timestamp raw timestamp token
 * @param blockHash opaque hex block identifier
 * @param peerId numeric peer identifier
 * @since 0.1.0
 */
public record BlockAnnounced(String timestamp, String blockHash, long peerId)
    implements CompactBlockEvent {

  /**
   * Validates components.
   */
  public BlockAnnounced {
    Objects.requireNonNull(timestamp, "timestamp");
    Objects.requireNonNull(blockHash, "blockHash");
  }

  @Override
  public EventKind kind() {
    return EventKind.ANNOUNCED;
  }
}
