package ca.gc.cra.cblog.application.correlate;

import ca.gc.cra.cblog.domain.event.BlockReconstructed;
import ca.gc.cra.cblog.domain.record.BlockReceiveRecord;

/** Mutable receive record owned by the engine until the pass finishes. */
final class ReceiveDraft {
  private final String blockHash;
  private final String timeReceived;
  private final long receivedSize;
  private String timeReconstructed;
  private long bytesMissing;
  private long txMissingCount;
  private long prefilledCount;
  private long mempoolCount;
  private long extraPoolCount;

  ReceiveDraft(String blockHash, String timeReceived, long receivedSize) {
    this.blockHash = blockHash;
    this.timeReceived = timeReceived;
    this.receivedSize = receivedSize;
  }

  void reconstructed(BlockReconstructed event) {
    this.timeReconstructed = event.timestamp();
    this.bytesMissing = event.requestedBytes();
    this.txMissingCount = event.requestedCount();
    this.prefilledCount = event.prefilledCount();
    this.mempoolCount = event.mempoolCount();
    this.extraPoolCount = event.extraPoolCount();
  }

  String blockHash() {
    return blockHash;
  }

  BlockReceiveRecord snapshot() {
    return new BlockReceiveRecord(
        blockHash,
        timeReceived,
        timeReconstructed,
        receivedSize,
        bytesMissing,
        txMissingCount,
        prefilledCount,
        mempoolCount,
        extraPoolCount);
  }
}
