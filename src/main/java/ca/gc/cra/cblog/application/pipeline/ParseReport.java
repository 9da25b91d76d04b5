package ca.gc.cra.cblog.application.pipeline;

import ca.gc.cra.cblog.application.correlate.CorrelationResult;
import ca.gc.cra.cblog.domain.event.EventKind;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one parse pass: the correlated records plus line accounting.
 *
 * @param result correlated records
 * @param linesRead lines pulled from the source, blank ones included
 * @param blankLines lines skipped because they were empty
 * @param malformedLines lines skipped because no timestamp could be separated
 * @param outsideWindow lines skipped by the time window
 * @param eventCounts classified events per kind
 * @since 0.1.0
 */
public record ParseReport(
    CorrelationResult result,
    long linesRead,
    long blankLines,
    long malformedLines,
    long outsideWindow,
    Map<EventKind, Long> eventCounts) {

  /**
   * Copies the event counts.
   */
  public ParseReport {
    Objects.requireNonNull(result, "result");
    eventCounts = eventCounts == null || eventCounts.isEmpty()
        ? Map.of()
        : Map.copyOf(new EnumMap<>(eventCounts));
  }

  /**
   * Total number of classified events.
   *
   * @return sum of {@link #eventCounts()}
   */
  public long eventsClassified() {
    long total = 0;
    for (long count : eventCounts.values()) {
      total += count;
    }
    return total;
  }
}
