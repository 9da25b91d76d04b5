package ca.gc.cra.cblog.application.report;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.cblog.application.correlate.CorrelationResult;
import ca.gc.cra.cblog.domain.record.BlockReceiveRecord;
import ca.gc.cra.cblog.domain.record.BlockSendRecord;
import ca.gc.cra.cblog.domain.record.SendTrigger;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import org.junit.jupiter.api.Test;

class CompactBlockTablesTest {

  @Test
  void derivesWindowColumnsForEachSend() {
    CompactBlockTables tables = CompactBlockTables.from(ReportFixtures.relayedBlocks());

    assertEquals(2, tables.sent().size());
    SentRow first = tables.sent().get(0);
    assertEquals(2000, first.prefillSize());
    assertEquals(OptionalLong.of(10000), first.windowBytesUsed());
    assertEquals(OptionalLong.of(5000), first.windowBytesAvailable());
    assertEquals(OptionalLong.of(0), first.rttsWithoutPrefill());
    assertTrue(first.prefillFits());

    SentRow second = tables.sent().get(1);
    assertEquals(6000, second.prefillSize());
    assertEquals(OptionalLong.of(6000), second.windowBytesUsed());
    assertEquals(OptionalLong.of(1000), second.windowBytesAvailable());
    assertEquals(OptionalLong.of(2), second.rttsWithoutPrefill());
    assertEquals(1500, second.receivedBytesMissing());
    assertEquals(3, second.receivedTxMissing());
    assertFalse(second.prefillFits());
  }

  @Test
  void receivedRowsKeepFirstSeenOrderAndReconstructionTime() {
    CompactBlockTables tables = CompactBlockTables.from(ReportFixtures.relayedBlocks());

    assertEquals(
        List.of(ReportFixtures.BLOCK_1, ReportFixtures.BLOCK_2, ReportFixtures.BLOCK_4),
        tables.received().stream().map(ReceivedRow::blockHash).toList());
    assertEquals(OptionalLong.of(250_000_000L), tables.received().get(0).reconstructionNanos());
    assertTrue(tables.received().get(1).failedReconstruction());
  }

  @Test
  void unparseableTimestampsLeaveReconstructionTimeEmpty() {
    BlockReceiveRecord record = new BlockReceiveRecord("aa", "T1", "T5", 100, 0, 0, 1, 2, 0);

    assertEquals(OptionalLong.empty(), CompactBlockTables.reconstructionNanos(record));
    assertEquals(OptionalLong.empty(),
        CompactBlockTables.reconstructionNanos(BlockReceiveRecord.received("aa", "2024-05-01T10:00:00Z", 100)));
  }

  @Test
  void sendWithoutWindowHasNoWindowColumns() {
    CorrelationResult result = new CorrelationResult(
        Map.of("aa", BlockReceiveRecord.received("aa", "T1", 100)),
        Map.of("aa", List.of(new BlockSendRecord("aa", 7, "T2", 90, 0, SendTrigger.REQUESTED))));

    SentRow row = CompactBlockTables.from(result).sent().get(0);

    assertEquals(-10, row.prefillSize());
    assertFalse(row.prefilled());
    assertTrue(row.windowBytesUsed().isEmpty());
    assertTrue(row.rttsWithoutPrefill().isEmpty());
    assertFalse(row.prefillFits());
  }

  @Test
  void sendsOfBlocksWithoutReceiptAreLeftOut() {
    CorrelationResult result = new CorrelationResult(
        Map.of(),
        Map.of("aa", List.of(new BlockSendRecord("aa", 7, "T2", 90, 1000, SendTrigger.ANNOUNCED))));

    assertTrue(CompactBlockTables.from(result).sent().isEmpty());
  }
}
