package ca.gc.cra.cblog.application.report;

import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Summary statistics over the derived tables. Each section is empty when its table has no rows.
 *
 * @param received reconstruction statistics
 * @param sent send and prefill statistics
 * @param window window size statistics over sends with a logged window
 * @param overWindow sends whose received block already exceeded one round trip
 * @since 0.1.0
 */
public record CompactBlockStats(
    Optional<ReceivedStats> received,
    Optional<SentStats> sent,
    Optional<WindowStats> window,
    Optional<OverWindowStats> overWindow) {

  /**
   * Reconstruction statistics.
   *
   * @param total received blocks
   * @param failed blocks that needed at least one requested transaction
   * @param averageReceivedSize mean compact block size
   * @param averageBytesMissing mean requested bytes over all blocks
   * @param averageBytesMissingWhenFailed mean requested bytes over failed blocks
   * @param averageReconstructionMillis mean reconstruction time over blocks with parseable timestamps
   */
  public record ReceivedStats(
      long total,
      long failed,
      double averageReceivedSize,
      double averageBytesMissing,
      OptionalDouble averageBytesMissingWhenFailed,
      OptionalDouble averageReconstructionMillis) {

    public double failureRate() {
      return (double) failed / total;
    }

    public double reconstructionRate() {
      return 1.0 - failureRate();
    }
  }

  /**
   * Send and prefill statistics.
   *
   * @param total sends
   * @param prefilled sends larger than the received compact block
   * @param averageSendSize mean send size
   * @param averagePrefilledSendSize mean send size of prefilled sends
   * @param averageUnprefilledSendSize mean send size of sends without prefill
   * @param averageAvailableBytes mean bytes left in the last round trip, over sends with a window
   * @param averageAvailableBytesWhenPrefilled same, over prefilled sends
   * @param averagePrefillSize mean prefill size of prefilled sends
   * @param prefillsThatFit prefilled sends whose prefill fits in the available bytes
   */
  public record SentStats(
      long total,
      long prefilled,
      double averageSendSize,
      OptionalDouble averagePrefilledSendSize,
      OptionalDouble averageUnprefilledSendSize,
      OptionalDouble averageAvailableBytes,
      OptionalDouble averageAvailableBytesWhenPrefilled,
      OptionalDouble averagePrefillSize,
      long prefillsThatFit) {

    public double prefillRate() {
      return (double) prefilled / total;
    }
  }

  /**
   * Window size statistics.
   *
   * @param count sends with a logged window
   * @param mean mean window size
   * @param median median window size
   * @param mode most frequent window size, smallest on ties
   * @param modeFrequency occurrences of {@code mode}
   * @param averageBytesUsed mean bytes used in the last round trip
   * @param averageBytesAvailable mean bytes left in the last round trip
   */
  public record WindowStats(
      long count,
      double mean,
      double median,
      long mode,
      long modeFrequency,
      double averageBytesUsed,
      double averageBytesAvailable) {}

  /**
   * Statistics for sends whose received block needed more than one round trip by itself.
   *
   * @param total sends considered
   * @param overWindow sends with more than one full round trip before prefilling
   * @param averageAvailableBytes mean bytes left in the last round trip over those sends
   * @param prefillsThatFit those sends whose prefill fits in the available bytes
   */
  public record OverWindowStats(
      long total,
      long overWindow,
      OptionalDouble averageAvailableBytes,
      long prefillsThatFit) {}
}
