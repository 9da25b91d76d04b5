package ca.gc.cra.cblog.application.report;

import ca.gc.cra.cblog.domain.record.SendTrigger;
import java.util.OptionalLong;

/**
 * One row of the sent table: a send record joined with the receive record of its block.
 *
 * <p>Window-derived columns are empty when no window size was logged for the send.</p>
 *
 * @param blockHash block identifier
 * @param peerId receiving peer
 * @param trigger announcement or request that opened the send
 * @param timeSent send timestamp token, {@code null} when never confirmed
 * @param tcpWindowSize per round-trip send allowance
 * @param receivedSize size of the compact block we received for this block
 * @param receivedBytesMissing bytes we had to request for this block
 * @param receivedTxMissing transactions we had to request for this block
 * @param sendSize size of the compact block we sent
 * @param prefillSize {@code sendSize - receivedSize}
 * @param windowBytesUsed {@code receivedSize mod tcpWindowSize}
 * @param windowBytesAvailable {@code tcpWindowSize - windowBytesUsed}
 * @param rttsWithoutPrefill {@code receivedSize div tcpWindowSize}
 * @since 0.1.0
 */
public record SentRow(
    String blockHash,
    long peerId,
    SendTrigger trigger,
    String timeSent,
    long tcpWindowSize,
    long receivedSize,
    long receivedBytesMissing,
    long receivedTxMissing,
    long sendSize,
    long prefillSize,
    OptionalLong windowBytesUsed,
    OptionalLong windowBytesAvailable,
    OptionalLong rttsWithoutPrefill) {

  /**
   * Whether the send carried more than the received compact block.
   *
   * @return {@code true} when {@code prefillSize > 0}
   */
  public boolean prefilled() {
    return prefillSize > 0;
  }

  /**
   * Whether the prefill fits in the bytes left in the last round trip.
   *
   * @return {@code true} when a window was logged and {@code prefillSize <= windowBytesAvailable}
   */
  public boolean prefillFits() {
    return windowBytesAvailable.isPresent() && prefillSize <= windowBytesAvailable.getAsLong();
  }
}
