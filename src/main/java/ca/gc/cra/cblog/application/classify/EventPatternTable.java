package ca.gc.cra.cblog.application.classify;

import ca.gc.cra.cblog.domain.event.EventKind;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> Ordered event patterns grouped by category.
 * <p><strong>Why:</strong> Classification is a two-level dispatch (category bucket, then pattern), so
 * a body can never match a pattern filed under a different category. Recognizing a new log line only
 * requires appending an entry.</p>
 * <p><strong>Thread-safety:</strong> Immutable after construction.</p>
 *
 * @since 0.1.0
 */
public final class EventPatternTable {
  static final String CMPCTBLOCK = "cmpctblock";
  static final String NET = "net";

  private static final EventPatternTable DEFAULTS = new EventPatternTable(List.of(
      EventPattern.of(
          EventKind.RECONSTRUCTED,
          CMPCTBLOCK,
          "Successfully reconstructed block (?<blockHash>[0-9a-fA-F]+) with (?<prefilledCount>\\d+) txn prefilled, "
              + "(?<mempoolCount>\\d+) txn from mempool \\(incl at least (?<extraPoolCount>\\d+) from extra pool\\) "
              + "and (?<requestedCount>\\d+) txn \\((?<requestedBytes>\\d+) bytes\\) requested"),
      EventPattern.of(
          EventKind.RECEIVED,
          CMPCTBLOCK,
          "Initialized PartiallyDownloadedBlock for block (?<blockHash>[0-9a-fA-F]+) using a cmpctblock of "
              + "(?<compactBlockBytes>\\d+) bytes"),
      EventPattern.of(
          EventKind.SENT,
          NET,
          "sending cmpctblock \\((?<bytes>\\d+) bytes\\) peer=(?<peerId>\\d+)"),
      EventPattern.of(
          EventKind.ANNOUNCED,
          NET,
          "PeerManager::NewPoWValidBlock sending header-and-ids (?<blockHash>[0-9a-fA-F]+) to peer=(?<peerId>\\d+)"),
      EventPattern.of(
          EventKind.REQUESTED,
          NET,
          "received getdata for: cmpctblock (?<blockHash>[0-9a-fA-F]+) peer=(?<peerId>\\d+)"),
      EventPattern.of(
          EventKind.WINDOW_SIZE_LOGGED,
          NET,
          "\\s*- Max send per-rtt: (?<maxSendBytes>\\d+) bytes")));

  private final List<EventPattern> entries;
  private final Map<String, List<EventPattern>> byCategory;

  /**
   * Creates a table preserving the supplied order inside each category.
   *
   * @param entries pattern entries; must not be {@code null} or empty
   */
  public EventPatternTable(List<EventPattern> entries) {
    Objects.requireNonNull(entries, "entries");
    if (entries.isEmpty()) {
      throw new IllegalArgumentException("pattern table must contain at least one entry");
    }
    this.entries = List.copyOf(entries);
    Map<String, List<EventPattern>> buckets = new LinkedHashMap<>();
    for (EventPattern entry : this.entries) {
      buckets.computeIfAbsent(entry.category(), ignored -> new ArrayList<>()).add(entry);
    }
    Map<String, List<EventPattern>> frozen = new LinkedHashMap<>();
    buckets.forEach((category, list) -> frozen.put(category, List.copyOf(list)));
    this.byCategory = Map.copyOf(frozen);
  }

  /**
   * Returns the patterns for the node's compact-block instrumentation.
   *
   * @return default table
   */
  public static EventPatternTable defaults() {
    return DEFAULTS;
  }

  /**
   * Returns the entries for one category in table order.
   *
   * @param category log category
   * @return possibly empty list
   */
  public List<EventPattern> forCategory(String category) {
    return byCategory.getOrDefault(category, List.of());
  }

  /**
   * Categories that have at least one pattern.
   *
   * @return interesting categories
   */
  public Set<String> categories() {
    return byCategory.keySet();
  }

  /**
   * All entries in declaration order.
   *
   * @return entries
   */
  public List<EventPattern> entries() {
    return entries;
  }
}
