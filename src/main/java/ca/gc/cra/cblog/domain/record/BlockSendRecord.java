package ca.gc.cra.cblog.domain.record;

import java.util.Objects;

/**
 * <strong>What:</strong> One transmission of a compact block to one peer.
 * <p><strong>Role:</strong> Output snapshot of the correlation engine. {@code blockHash} refers to a
 * {@link BlockReceiveRecord} by key; the receive record is never embedded.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param blockHash hash of the block being relayed; never {@code null}
 * @param peerId receiving peer
 * @param timeSent timestamp of the send line; {@code null} when the send was never confirmed
 * @param sendSize compact block message size, {@code 0} until confirmed
 * @param tcpWindowSize per round-trip send allowance, {@code 0} until logged
 * @param trigger event that opened the transmission; never {@code null}
 * @since 0.1.0
 */
public record BlockSendRecord(
    String blockHash,
    long peerId,
    String timeSent,
    long sendSize,
    long tcpWindowSize,
    SendTrigger trigger) {

  /**
   * Validates required components.
   */
  public BlockSendRecord {
    Objects.requireNonNull(blockHash, "blockHash");
    Objects.requireNonNull(trigger, "trigger");
  }

  /**
   * Indicates whether the send line was attributed to this transmission.
   *
   * @return {@code true} once {@link #timeSent()} is set
   */
  public boolean isSent() {
    return timeSent != null;
  }
}
