package ca.gc.cra.cblog.application.correlate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.cblog.application.classify.LineClassifier;
import ca.gc.cra.cblog.application.port.RecordingMetricsPort;
import ca.gc.cra.cblog.domain.event.BlockAnnounced;
import ca.gc.cra.cblog.domain.event.BlockReceived;
import ca.gc.cra.cblog.domain.event.BlockReconstructed;
import ca.gc.cra.cblog.domain.event.BlockRequested;
import ca.gc.cra.cblog.domain.event.CompactBlockSent;
import ca.gc.cra.cblog.domain.event.WindowSizeLogged;
import ca.gc.cra.cblog.domain.line.LogLineParser;
import ca.gc.cra.cblog.domain.line.MalformedLineException;
import ca.gc.cra.cblog.domain.record.BlockReceiveRecord;
import ca.gc.cra.cblog.domain.record.BlockSendRecord;
import ca.gc.cra.cblog.domain.record.SendTrigger;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CompactBlockCorrelationEngineTest {
  private RecordingMetricsPort metrics;
  private CompactBlockCorrelationEngine engine;

  @BeforeEach
  void setUp() {
    metrics = new RecordingMetricsPort();
    engine = new CompactBlockCorrelationEngine(metrics);
  }

  @Test
  void relayOfOneBlockProducesOneReceiveAndOneSend() throws MalformedLineException {
    LogLineParser parser = new LogLineParser();
    LineClassifier classifier = new LineClassifier();
    List<String> lines = List.of(
        "T1 [cmpctblock] Initialized PartiallyDownloadedBlock for block AA using a cmpctblock of 100 bytes",
        "T2 [net] PeerManager::NewPoWValidBlock sending header-and-ids AA to peer=7",
        "T3 [net] sending cmpctblock (120 bytes) peer=7",
        "T4 [net]     - Max send per-rtt: 1500 bytes",
        "T5 [cmpctblock] Successfully reconstructed block AA with 1 txn prefilled, 2 txn from mempool "
            + "(incl at least 0 from extra pool) and 0 txn (0 bytes) requested");
    for (String line : lines) {
      classifier.classify(parser.parse(line)).ifPresent(engine::accept);
    }

    CorrelationResult result = engine.finish();

    assertEquals(
        new BlockReceiveRecord("AA", "T1", "T5", 100, 0, 0, 1, 2, 0),
        result.receives().get("AA"));
    assertEquals(
        List.of(new BlockSendRecord("AA", 7, "T3", 120, 1500, SendTrigger.ANNOUNCED)),
        result.sends().get("AA"));
  }

  @Test
  void secondReceiptWithoutReconstructionDiscardsTheFirst() {
    engine.accept(new BlockReceived("T1", "aa", 100));
    engine.accept(new BlockReceived("T2", "bb", 200));

    CorrelationResult result = engine.finish();

    assertFalse(result.receives().containsKey("aa"));
    assertTrue(result.receives().containsKey("bb"));
    assertEquals(1, metrics.count("correlate.receive.orphaned"));
  }

  @Test
  void repeatedReceiptOfTheSameBlockReplacesIt() {
    engine.accept(new BlockReceived("T1", "aa", 100));
    engine.accept(new BlockReceived("T2", "aa", 150));

    BlockReceiveRecord record = engine.finish().receives().get("aa");

    assertEquals("T2", record.timeReceived());
    assertEquals(150, record.receivedSize());
    assertEquals(0, metrics.count("correlate.receive.orphaned"));
  }

  @Test
  void reconstructedBlockSurvivesLaterReceipts() {
    engine.accept(new BlockReceived("T1", "aa", 100));
    engine.accept(new BlockReconstructed("T2", "aa", 1, 10, 0, 2, 300));
    engine.accept(new BlockReceived("T3", "bb", 200));

    CorrelationResult result = engine.finish();

    assertEquals(2, result.receives().size());
    BlockReceiveRecord aa = result.receives().get("aa");
    assertTrue(aa.isReconstructed());
    assertEquals(300, aa.bytesMissing());
    assertEquals(2, aa.txMissingCount());
    assertFalse(result.receives().get("bb").isReconstructed());
  }

  @Test
  void reconstructionOfANonPendingBlockIsSkipped() {
    engine.accept(new BlockReceived("T1", "aa", 100));
    engine.accept(new BlockReconstructed("T2", "ff", 1, 10, 0, 0, 0));

    CorrelationResult result = engine.finish();

    assertNull(result.receives().get("aa").timeReconstructed());
    assertFalse(result.receives().containsKey("ff"));
    assertEquals(1, metrics.count("correlate.reconstruction.unexpected"));
  }

  @Test
  void secondReconstructionOfTheSameBlockIsSkipped() {
    engine.accept(new BlockReceived("T1", "aa", 100));
    engine.accept(new BlockReconstructed("T2", "aa", 1, 10, 0, 0, 0));
    engine.accept(new BlockReconstructed("T3", "aa", 1, 10, 0, 5, 900));

    BlockReceiveRecord record = engine.finish().receives().get("aa");

    assertEquals("T2", record.timeReconstructed());
    assertEquals(0, record.bytesMissing());
    assertEquals(1, metrics.count("correlate.reconstruction.unexpected"));
  }

  @Test
  void announcementOfUnknownBlockIsDropped() {
    engine.accept(new BlockAnnounced("T1", "aa", 7));
    engine.accept(new CompactBlockSent("T2", 7, 120));

    CorrelationResult result = engine.finish();

    assertTrue(result.sends().isEmpty());
    assertEquals(1, metrics.count("correlate.send.unknownBlock"));
    assertEquals(1, metrics.count("correlate.sent.unattributed"));
  }

  @Test
  void requestedSendIsTaggedWithItsTrigger() {
    engine.accept(new BlockReceived("T1", "aa", 100));
    engine.accept(new BlockRequested("T2", "aa", 9));
    engine.accept(new CompactBlockSent("T3", 9, 130));

    BlockSendRecord send = engine.finish().sends().get("aa").get(0);

    assertEquals(SendTrigger.REQUESTED, send.trigger());
    assertEquals(9, send.peerId());
    assertEquals(0, send.tcpWindowSize());
  }

  @Test
  void supersededAnnouncementStaysUnsent() {
    engine.accept(new BlockReceived("T1", "aa", 100));
    engine.accept(new BlockAnnounced("T2", "aa", 7));
    engine.accept(new BlockAnnounced("T3", "aa", 8));
    engine.accept(new CompactBlockSent("T4", 8, 120));

    List<BlockSendRecord> sends = engine.finish().sends().get("aa");

    assertEquals(2, sends.size());
    assertFalse(sends.get(0).isSent());
    assertEquals(7, sends.get(0).peerId());
    assertTrue(sends.get(1).isSent());
    assertEquals(8, sends.get(1).peerId());
  }

  @Test
  void sendToAnotherPeerAbortsAndLeavesNoRecord() {
    engine.accept(new BlockReceived("T1", "aa", 100));
    engine.accept(new BlockAnnounced("T2", "aa", 7));

    PeerMismatchException ex = assertThrows(
        PeerMismatchException.class, () -> engine.accept(new CompactBlockSent("T3", 8, 120)));

    assertEquals("aa", ex.blockHash());
    assertEquals(7, ex.expectedPeer());
    assertEquals(8, ex.observedPeer());
    assertEquals("T3", ex.timestamp());
    assertFalse(engine.finish().sends().containsKey("aa"));
  }

  @Test
  void windowSizeAttachesOnlyToTheLastSend() {
    engine.accept(new BlockReceived("T1", "aa", 100));
    engine.accept(new BlockAnnounced("T2", "aa", 7));
    engine.accept(new CompactBlockSent("T3", 7, 120));
    engine.accept(new WindowSizeLogged("T4", 1500));
    engine.accept(new WindowSizeLogged("T5", 2500));

    BlockSendRecord send = engine.finish().sends().get("aa").get(0);

    assertEquals(1500, send.tcpWindowSize());
    assertEquals(1, metrics.count("correlate.window.unattributed"));
  }

  @Test
  void windowSizeBeforeAnySendIsIgnored() {
    engine.accept(new WindowSizeLogged("T1", 1500));
    engine.accept(new BlockReceived("T2", "aa", 100));
    engine.accept(new BlockAnnounced("T3", "aa", 7));

    BlockSendRecord send = engine.finish().sends().get("aa").get(0);

    assertEquals(0, send.tcpWindowSize());
    assertFalse(send.isSent());
    assertEquals(1, metrics.count("correlate.window.unattributed"));
  }

  @Test
  void sendsToSeveralPeersAreKeptInOrder() {
    engine.accept(new BlockReceived("T1", "aa", 100));
    engine.accept(new BlockAnnounced("T2", "aa", 7));
    engine.accept(new CompactBlockSent("T3", 7, 120));
    engine.accept(new BlockRequested("T4", "aa", 9));
    engine.accept(new CompactBlockSent("T5", 9, 125));
    engine.accept(new WindowSizeLogged("T6", 4000));

    CorrelationResult result = engine.finish();
    List<BlockSendRecord> sends = result.sends().get("aa");

    assertEquals(2, result.sendCount());
    assertEquals(List.of(7L, 9L), List.of(sends.get(0).peerId(), sends.get(1).peerId()));
    assertEquals(0, sends.get(0).tcpWindowSize());
    assertEquals(4000, sends.get(1).tcpWindowSize());
  }

  @Test
  void finishWithoutEventsIsEmpty() {
    assertEquals(CorrelationResult.empty(), engine.finish());
  }
}
