package ca.gc.cra.cblog.application.correlate;

import ca.gc.cra.cblog.domain.record.BlockSendRecord;
import ca.gc.cra.cblog.domain.record.SendTrigger;

/** Mutable send record owned by the engine until the pass finishes. */
final class SendDraft {
  private final String blockHash;
  private final long peerId;
  private final SendTrigger trigger;
  private String timeSent;
  private long sendSize;
  private long tcpWindowSize;

  SendDraft(String blockHash, long peerId, SendTrigger trigger) {
    this.blockHash = blockHash;
    this.peerId = peerId;
    this.trigger = trigger;
  }

  void sent(String timestamp, long bytes) {
    this.timeSent = timestamp;
    this.sendSize = bytes;
  }

  void windowSize(long maxSendBytes) {
    this.tcpWindowSize = maxSendBytes;
  }

  String blockHash() {
    return blockHash;
  }

  long peerId() {
    return peerId;
  }

  BlockSendRecord snapshot() {
    return new BlockSendRecord(blockHash, peerId, timeSent, sendSize, tcpWindowSize, trigger);
  }
}
