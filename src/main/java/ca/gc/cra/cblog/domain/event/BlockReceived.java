package ca.gc.cra.cblog.domain.event;

import java.util.Objects;

/**
 * A compact block for {@code blockHash} was received and partial download state initialized.
 *
 * @param timestamp raw timestamp token
 * @param blockHash opaque hex block identifier
 * @param compactBlockBytes size of the received compact block message
 * @since 0.1.0
 */
public record BlockReceived(String timestamp, String blockHash, long compactBlockBytes)
    implements CompactBlockEvent {

  /**
   * Validates components.
   */
  public BlockReceived {
    Objects.requireNonNull(timestamp, "timestamp");
    Objects.requireNonNull(blockHash, "blockHash");
  }

  @Override
  public EventKind kind() {
    return EventKind.RECEIVED;
  }
}
