package ca.gc.cra.cblog.application.correlate;

import ca.gc.cra.cblog.domain.record.BlockReceiveRecord;
import ca.gc.cra.cblog.domain.record.BlockSendRecord;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Records committed by one correlation pass, in first-seen order.
 *
 * @param receives block hash to receive record
 * @param sends block hash to send records in log order
 * @since 0.1.0
 */
public record CorrelationResult(
    Map<String, BlockReceiveRecord> receives,
    Map<String, List<BlockSendRecord>> sends) {

  /**
   * Copies both maps into order-preserving, unmodifiable views.
   */
  public CorrelationResult {
    Objects.requireNonNull(receives, "receives");
    Objects.requireNonNull(sends, "sends");
    receives = Collections.unmodifiableMap(new LinkedHashMap<>(receives));
    Map<String, List<BlockSendRecord>> copy = new LinkedHashMap<>();
    sends.forEach((hash, list) -> copy.put(hash, List.copyOf(list)));
    sends = Collections.unmodifiableMap(copy);
  }

  /**
   * Returns a result with no records.
   *
   * @return empty result
   */
  public static CorrelationResult empty() {
    return new CorrelationResult(Map.of(), Map.of());
  }

  /**
   * Counts send records across all blocks.
   *
   * @return total number of send records
   */
  public int sendCount() {
    int total = 0;
    for (List<BlockSendRecord> list : sends.values()) {
      total += list.size();
    }
    return total;
  }
}
