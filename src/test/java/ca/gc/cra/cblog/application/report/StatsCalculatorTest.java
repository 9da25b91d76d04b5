package ca.gc.cra.cblog.application.report;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.cblog.application.correlate.CorrelationResult;
import ca.gc.cra.cblog.domain.record.SendTrigger;
import java.util.List;
import java.util.OptionalLong;
import org.junit.jupiter.api.Test;

class StatsCalculatorTest {
  private static final double DELTA = 1e-6;

  private final StatsCalculator calculator = new StatsCalculator();

  @Test
  void receivedSection() {
    CompactBlockStats.ReceivedStats received = stats().received().orElseThrow();

    assertEquals(3, received.total());
    assertEquals(1, received.failed());
    assertEquals(70000.0 / 3, received.averageReceivedSize(), DELTA);
    assertEquals(500.0, received.averageBytesMissing(), DELTA);
    assertEquals(1500.0, received.averageBytesMissingWhenFailed().getAsDouble(), DELTA);
    assertEquals(950.0 / 3, received.averageReconstructionMillis().getAsDouble(), DELTA);
    assertEquals(2.0 / 3, received.reconstructionRate(), DELTA);
  }

  @Test
  void sentSection() {
    CompactBlockStats.SentStats sent = stats().sent().orElseThrow();

    assertEquals(2, sent.total());
    assertEquals(2, sent.prefilled());
    assertEquals(19000.0, sent.averageSendSize(), DELTA);
    assertTrue(sent.averageUnprefilledSendSize().isEmpty());
    assertEquals(3000.0, sent.averageAvailableBytes().getAsDouble(), DELTA);
    assertEquals(4000.0, sent.averagePrefillSize().getAsDouble(), DELTA);
    assertEquals(1, sent.prefillsThatFit());
  }

  @Test
  void windowSectionBreaksModeTiesTowardsTheSmallestSize() {
    CompactBlockStats.WindowStats window = stats().window().orElseThrow();

    assertEquals(2, window.count());
    assertEquals(11000.0, window.mean(), DELTA);
    assertEquals(11000.0, window.median(), DELTA);
    assertEquals(7000, window.mode());
    assertEquals(1, window.modeFrequency());
    assertEquals(8000.0, window.averageBytesUsed(), DELTA);
    assertEquals(3000.0, window.averageBytesAvailable(), DELTA);
  }

  @Test
  void overWindowCountsOnlyBlocksNeedingMoreThanOneRoundTrip() {
    CompactBlockStats.OverWindowStats over = stats().overWindow().orElseThrow();

    assertEquals(2, over.total());
    assertEquals(1, over.overWindow());
    assertEquals(1000.0, over.averageAvailableBytes().getAsDouble(), DELTA);
    assertEquals(0, over.prefillsThatFit());
  }

  @Test
  void modePicksTheMostFrequentSize() {
    List<SentRow> rows = List.of(row(1500), row(4000), row(4000), row(9000));

    CompactBlockStats.WindowStats window = calculator.windowStats(rows).orElseThrow();

    assertEquals(4000, window.mode());
    assertEquals(2, window.modeFrequency());
    assertEquals(4000.0, window.median(), DELTA);
  }

  @Test
  void emptyResultHasNoSections() {
    CompactBlockStats stats = calculator.compute(CompactBlockTables.from(CorrelationResult.empty()));

    assertFalse(stats.received().isPresent());
    assertFalse(stats.sent().isPresent());
    assertFalse(stats.window().isPresent());
    assertFalse(stats.overWindow().isPresent());
  }

  private CompactBlockStats stats() {
    return calculator.compute(CompactBlockTables.from(ReportFixtures.relayedBlocks()));
  }

  private static SentRow row(long window) {
    long received = 1000;
    return new SentRow("aa", 1, SendTrigger.ANNOUNCED, "T", window, received, 0, 0, received, 0,
        OptionalLong.of(received % window), OptionalLong.of(window - received % window),
        OptionalLong.of(received / window));
  }
}
