package ca.gc.cra.cblog.domain.record;

import java.util.Objects;

/**
 * <strong>What:</strong> Receive-side history of one compact block, keyed by block hash.
 * <p><strong>Why:</strong> Joins the "initialized" and "reconstructed" log lines of the same block so
 * reports can relate received size to what still had to be fetched.</p>
 * <p><strong>Role:</strong> Output snapshot of the correlation engine.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param blockHash opaque hex block identifier; never {@code null}
 * @param timeReceived timestamp of the receive line; never {@code null}
 * @param timeReconstructed timestamp of the reconstruction line; {@code null} until reconstructed
 * @param receivedSize compact block size in bytes
 * @param bytesMissing bytes of transactions requested after the compact block arrived
 * @param txMissingCount number of transactions requested after the compact block arrived
 * @param prefilledCount transactions prefilled by the sender
 * @param mempoolCount transactions supplied by the local mempool
 * @param extraPoolCount lower bound of transactions supplied by the extra pool
 * @since 0.1.0
 */
public record BlockReceiveRecord(
    String blockHash,
    String timeReceived,
    String timeReconstructed,
    long receivedSize,
    long bytesMissing,
    long txMissingCount,
    long prefilledCount,
    long mempoolCount,
    long extraPoolCount) {

  /**
   * Validates required components.
   */
  public BlockReceiveRecord {
    Objects.requireNonNull(blockHash, "blockHash");
    Objects.requireNonNull(timeReceived, "timeReceived");
  }

  /**
   * Creates a record for a block that has been received but not yet reconstructed.
   *
   * @param blockHash block identifier
   * @param timeReceived receive timestamp
   * @param receivedSize compact block size
   * @return unreconstructed record
   */
  public static BlockReceiveRecord received(String blockHash, String timeReceived, long receivedSize) {
    return new BlockReceiveRecord(blockHash, timeReceived, null, receivedSize, 0, 0, 0, 0, 0);
  }

  /**
   * Indicates whether the reconstruction line was observed.
   *
   * @return {@code true} once {@link #timeReconstructed()} is set
   */
  public boolean isReconstructed() {
    return timeReconstructed != null;
  }
}
