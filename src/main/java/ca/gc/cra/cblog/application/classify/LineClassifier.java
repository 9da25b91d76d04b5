package ca.gc.cra.cblog.application.classify;

import ca.gc.cra.cblog.domain.event.BlockAnnounced;
import ca.gc.cra.cblog.domain.event.BlockReceived;
import ca.gc.cra.cblog.domain.event.BlockReconstructed;
import ca.gc.cra.cblog.domain.event.BlockRequested;
import ca.gc.cra.cblog.domain.event.CompactBlockEvent;
import ca.gc.cra.cblog.domain.event.CompactBlockSent;
import ca.gc.cra.cblog.domain.event.EventKind;
import ca.gc.cra.cblog.domain.event.WindowSizeLogged;
import ca.gc.cra.cblog.domain.line.LogLine;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;

/**
 * <strong>What:</strong> Maps a parsed log line to a typed compact-block event.
 * <p><strong>Why:</strong> Keeps string matching out of the correlation engine; only lines that
 * produce an event reach it.</p>
 * <p><strong>Role:</strong> Pure function between the line parser and the correlation engine.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Select the category bucket; lines without a category are uninteresting.</li>
 *   <li>Try the bucket's patterns in table order; the first match wins.</li>
 *   <li>Convert captured groups into the event's typed fields.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless apart from the immutable table; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class LineClassifier {
  private final EventPatternTable table;

  /**
   * Creates a classifier backed by {@code table}.
   *
   * @param table pattern table; must not be {@code null}
   */
  public LineClassifier(EventPatternTable table) {
    this.table = Objects.requireNonNull(table, "table");
  }

  /**
   * Creates a classifier using {@link EventPatternTable#defaults()}.
   */
  public LineClassifier() {
    this(EventPatternTable.defaults());
  }

  /**
   * Classifies a parsed line.
   *
   * @param line parsed line
   * @return event, or empty when the line is uninteresting
   * @throws NumberFormatException if a numeric field overflows a {@code long}
   */
  public Optional<CompactBlockEvent> classify(LogLine line) {
    Objects.requireNonNull(line, "line");
    String category = line.metadata().category();
    if (category == null) {
      return Optional.empty();
    }
    return classify(line.timestamp(), category, line.body());
  }

  /**
   * Classifies a {@code (category, body)} pair.
   *
   * @param timestamp timestamp token attached to the event
   * @param category log category
   * @param body message body
   * @return event, or empty when no pattern of the category matches
   */
  public Optional<CompactBlockEvent> classify(String timestamp, String category, String body) {
    Objects.requireNonNull(timestamp, "timestamp");
    Objects.requireNonNull(body, "body");
    for (EventPattern entry : table.forCategory(category)) {
      Matcher matcher = entry.match(body);
      if (matcher != null) {
        return Optional.of(toEvent(entry.kind(), timestamp, matcher));
      }
    }
    return Optional.empty();
  }

  private static CompactBlockEvent toEvent(EventKind kind, String timestamp, Matcher m) {
    return switch (kind) {
      case RECEIVED -> new BlockReceived(
          timestamp, m.group("blockHash"), number(m, "compactBlockBytes"));
      case RECONSTRUCTED -> new BlockReconstructed(
          timestamp,
          m.group("blockHash"),
          number(m, "prefilledCount"),
          number(m, "mempoolCount"),
          number(m, "extraPoolCount"),
          number(m, "requestedCount"),
          number(m, "requestedBytes"));
      case ANNOUNCED -> new BlockAnnounced(timestamp, m.group("blockHash"), number(m, "peerId"));
      case REQUESTED -> new BlockRequested(timestamp, m.group("blockHash"), number(m, "peerId"));
      case SENT -> new CompactBlockSent(timestamp, number(m, "peerId"), number(m, "bytes"));
      case WINDOW_SIZE_LOGGED -> new WindowSizeLogged(timestamp, number(m, "maxSendBytes"));
    };
  }

  private static long number(Matcher matcher, String group) {
    return Long.parseLong(matcher.group(group));
  }
}
