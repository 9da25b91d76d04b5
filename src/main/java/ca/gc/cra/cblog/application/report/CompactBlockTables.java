package ca.gc.cra.cblog.application.report;

import ca.gc.cra.cblog.application.correlate.CorrelationResult;
import ca.gc.cra.cblog.domain.record.BlockReceiveRecord;
import ca.gc.cra.cblog.domain.record.BlockSendRecord;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * <strong>What:</strong> Flat received and sent tables derived from a correlation result.
 * <p><strong>Why:</strong> Exporters and statistics work on rows; the derived columns are computed
 * here once and the correlation result is never modified.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param received one row per receive record, in first-seen order
 * @param sent one row per send record whose block has a receive record
 * @since 0.1.0
 */
public record CompactBlockTables(List<ReceivedRow> received, List<SentRow> sent) {

  /**
   * Copies both lists.
   */
  public CompactBlockTables {
    received = List.copyOf(Objects.requireNonNull(received, "received"));
    sent = List.copyOf(Objects.requireNonNull(sent, "sent"));
  }

  /**
   * Derives both tables.
   *
   * @param result correlation output
   * @return derived tables
   */
  public static CompactBlockTables from(CorrelationResult result) {
    Objects.requireNonNull(result, "result");
    List<ReceivedRow> received = new ArrayList<>(result.receives().size());
    for (BlockReceiveRecord record : result.receives().values()) {
      received.add(toReceivedRow(record));
    }
    List<SentRow> sent = new ArrayList<>();
    for (Map.Entry<String, List<BlockSendRecord>> entry : result.sends().entrySet()) {
      BlockReceiveRecord receive = result.receives().get(entry.getKey());
      if (receive == null) {
        // block was orphaned after it was relayed
        continue;
      }
      for (BlockSendRecord send : entry.getValue()) {
        sent.add(toSentRow(send, receive));
      }
    }
    return new CompactBlockTables(received, sent);
  }

  private static ReceivedRow toReceivedRow(BlockReceiveRecord record) {
    return new ReceivedRow(
        record.blockHash(),
        record.timeReceived(),
        record.timeReconstructed(),
        record.receivedSize(),
        record.bytesMissing(),
        record.txMissingCount(),
        record.prefilledCount(),
        record.mempoolCount(),
        record.extraPoolCount(),
        reconstructionNanos(record));
  }

  private static SentRow toSentRow(BlockSendRecord send, BlockReceiveRecord receive) {
    long window = send.tcpWindowSize();
    long receivedSize = receive.receivedSize();
    OptionalLong used = OptionalLong.empty();
    OptionalLong available = OptionalLong.empty();
    OptionalLong rtts = OptionalLong.empty();
    if (window > 0) {
      long usedBytes = receivedSize % window;
      used = OptionalLong.of(usedBytes);
      available = OptionalLong.of(window - usedBytes);
      rtts = OptionalLong.of(receivedSize / window);
    }
    return new SentRow(
        send.blockHash(),
        send.peerId(),
        send.trigger(),
        send.timeSent(),
        window,
        receivedSize,
        receive.bytesMissing(),
        receive.txMissingCount(),
        send.sendSize(),
        send.sendSize() - receivedSize,
        used,
        available,
        rtts);
  }

  static OptionalLong reconstructionNanos(BlockReceiveRecord record) {
    if (!record.isReconstructed()) {
      return OptionalLong.empty();
    }
    try {
      Instant received = Instant.parse(record.timeReceived());
      Instant reconstructed = Instant.parse(record.timeReconstructed());
      return OptionalLong.of(Duration.between(received, reconstructed).toNanos());
    } catch (DateTimeParseException | ArithmeticException ex) {
      return OptionalLong.empty();
    }
  }
}
