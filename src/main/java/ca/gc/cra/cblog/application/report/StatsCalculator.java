package ca.gc.cra.cblog.application.report;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Computes {@link CompactBlockStats} from derived tables.
 *
 * @since 0.1.0
 */
public final class StatsCalculator {

  /**
   * Computes every statistics section.
   *
   * @param tables derived tables
   * @return statistics; sections without input rows are empty
   */
  public CompactBlockStats compute(CompactBlockTables tables) {
    Objects.requireNonNull(tables, "tables");
    return new CompactBlockStats(
        receivedStats(tables.received()),
        sentStats(tables.sent()),
        windowStats(tables.sent()),
        overWindowStats(tables.sent()));
  }

  Optional<CompactBlockStats.ReceivedStats> receivedStats(List<ReceivedRow> rows) {
    if (rows.isEmpty()) {
      return Optional.empty();
    }
    List<ReceivedRow> failed = rows.stream().filter(ReceivedRow::failedReconstruction).collect(Collectors.toList());
    OptionalDouble reconstructionMillis = rows.stream()
        .filter(row -> row.reconstructionNanos().isPresent())
        .mapToDouble(row -> row.reconstructionNanos().getAsLong() / 1_000_000.0)
        .average();
    return Optional.of(new CompactBlockStats.ReceivedStats(
        rows.size(),
        failed.size(),
        rows.stream().mapToLong(ReceivedRow::receivedSize).average().orElse(0),
        rows.stream().mapToLong(ReceivedRow::bytesMissing).average().orElse(0),
        failed.stream().mapToLong(ReceivedRow::bytesMissing).average(),
        reconstructionMillis));
  }

  Optional<CompactBlockStats.SentStats> sentStats(List<SentRow> rows) {
    if (rows.isEmpty()) {
      return Optional.empty();
    }
    List<SentRow> prefilled = rows.stream().filter(SentRow::prefilled).collect(Collectors.toList());
    return Optional.of(new CompactBlockStats.SentStats(
        rows.size(),
        prefilled.size(),
        rows.stream().mapToLong(SentRow::sendSize).average().orElse(0),
        prefilled.stream().mapToLong(SentRow::sendSize).average(),
        rows.stream().filter(row -> row.prefillSize() == 0).mapToLong(SentRow::sendSize).average(),
        averageAvailable(rows),
        averageAvailable(prefilled),
        prefilled.stream().mapToLong(SentRow::prefillSize).average(),
        prefilled.stream().filter(SentRow::prefillFits).count()));
  }

  Optional<CompactBlockStats.WindowStats> windowStats(List<SentRow> rows) {
    List<SentRow> windowed = rows.stream()
        .filter(row -> row.tcpWindowSize() > 0)
        .collect(Collectors.toList());
    if (windowed.isEmpty()) {
      return Optional.empty();
    }
    long[] sizes = windowed.stream().mapToLong(SentRow::tcpWindowSize).sorted().toArray();
    Map<Long, Long> frequencies = new TreeMap<>();
    for (long size : sizes) {
      frequencies.merge(size, 1L, Long::sum);
    }
    long mode = sizes[0];
    long modeFrequency = 0;
    for (Map.Entry<Long, Long> entry : frequencies.entrySet()) {
      if (entry.getValue() > modeFrequency) {
        mode = entry.getKey();
        modeFrequency = entry.getValue();
      }
    }
    return Optional.of(new CompactBlockStats.WindowStats(
        sizes.length,
        Arrays.stream(sizes).average().orElse(0),
        median(sizes),
        mode,
        modeFrequency,
        windowed.stream().mapToLong(row -> row.windowBytesUsed().getAsLong()).average().orElse(0),
        windowed.stream().mapToLong(row -> row.windowBytesAvailable().getAsLong()).average().orElse(0)));
  }

  Optional<CompactBlockStats.OverWindowStats> overWindowStats(List<SentRow> rows) {
    if (rows.isEmpty()) {
      return Optional.empty();
    }
    List<SentRow> over = rows.stream()
        .filter(row -> row.rttsWithoutPrefill().isPresent() && row.rttsWithoutPrefill().getAsLong() > 1)
        .collect(Collectors.toList());
    return Optional.of(new CompactBlockStats.OverWindowStats(
        rows.size(),
        over.size(),
        averageAvailable(over),
        over.stream().filter(SentRow::prefillFits).count()));
  }

  private static OptionalDouble averageAvailable(List<SentRow> rows) {
    return rows.stream()
        .filter(row -> row.windowBytesAvailable().isPresent())
        .mapToLong(row -> row.windowBytesAvailable().getAsLong())
        .average();
  }

  private static double median(long[] sorted) {
    int mid = sorted.length / 2;
    if (sorted.length % 2 == 1) {
      return sorted[mid];
    }
    return (sorted[mid - 1] + sorted[mid]) / 2.0;
  }
}
