package ca.gc.cra.cblog.application.report;

import java.util.OptionalLong;

/**
 * One row of the received table.
 *
 * @param blockHash block identifier
 * @param timeReceived receive timestamp token
 * @param timeReconstructed reconstruction timestamp token, {@code null} when never reconstructed
 * @param receivedSize compact block size
 * @param bytesMissing bytes requested after receipt
 * @param txMissingCount transactions requested after receipt
 * @param prefilledCount transactions prefilled by the sender
 * @param mempoolCount transactions found in the mempool
 * @param extraPoolCount transactions found in the extra pool (lower bound)
 * @param reconstructionNanos time between receipt and reconstruction, when both timestamps parse
 * @since 0.1.0
 */
public record ReceivedRow(
    String blockHash,
    String timeReceived,
    String timeReconstructed,
    long receivedSize,
    long bytesMissing,
    long txMissingCount,
    long prefilledCount,
    long mempoolCount,
    long extraPoolCount,
    OptionalLong reconstructionNanos) {

  /**
   * Whether reconstruction had to request transactions.
   *
   * @return {@code true} when {@code txMissingCount > 0}
   */
  public boolean failedReconstruction() {
    return txMissingCount > 0;
  }
}
