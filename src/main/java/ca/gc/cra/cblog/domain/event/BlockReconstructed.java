package ca.gc.cra.cblog.domain.event;

import java.util.Objects;

/**
 * A partially downloaded block was reconstructed.
 *
 * @param timestamp raw timestamp token
 * @param blockHash opaque hex block identifier
 * @param prefilledCount transactions carried inside the compact block
 * @param mempoolCount transactions found in the local mempool
 * @param extraPoolCount lower bound of mempool transactions that came from the extra pool
 * @param requestedCount transactions that had to be requested from the peer
 * @param requestedBytes size of the requested transactions
 * @since 0.1.0
 */
public record BlockReconstructed(
    String timestamp,
    String blockHash,
    long prefilledCount,
    long mempoolCount,
    long extraPoolCount,
    long requestedCount,
    long requestedBytes) implements CompactBlockEvent {

  /**
   * Validates components.
   */
  public BlockReconstructed {
    Objects.requireNonNull(timestamp, "timestamp");
    Objects.requireNonNull(blockHash, "blockHash");
  }

  @Override
  public EventKind kind() {
    return EventKind.RECONSTRUCTED;
  }
}
