package ca.gc.cra.cblog.application.correlate;

import ca.gc.cra.cblog.application.port.EventCorrelator;
import ca.gc.cra.cblog.application.port.MetricsPort;
import ca.gc.cra.cblog.domain.event.BlockAnnounced;
import ca.gc.cra.cblog.domain.event.BlockReceived;
import ca.gc.cra.cblog.domain.event.BlockReconstructed;
import ca.gc.cra.cblog.domain.event.BlockRequested;
import ca.gc.cra.cblog.domain.event.CompactBlockEvent;
import ca.gc.cra.cblog.domain.event.CompactBlockSent;
import ca.gc.cra.cblog.domain.event.WindowSizeLogged;
import ca.gc.cra.cblog.domain.record.BlockReceiveRecord;
import ca.gc.cra.cblog.domain.record.BlockSendRecord;
import ca.gc.cra.cblog.domain.record.SendTrigger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Single-pass state machine that joins compact-block events into receive and
 * send records.
 * <p><strong>Why:</strong> The node logs each step of a relay on its own line. Receipt and
 * reconstruction share a block hash; announcement or request, send and window size are only tied
 * together by arrival order.</p>
 * <p><strong>Role:</strong> {@link EventCorrelator} driven by the parse use case.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Discard a receipt that is superseded before its reconstruction is logged.</li>
 *   <li>Skip reconstructions that do not match the pending receipt.</li>
 *   <li>Attribute each send and window size to the most recent announcement or request.</li>
 *   <li>Abort when a send names a different peer than the pending transmission.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; events must arrive in log order from one thread.</p>
 * <p><strong>Observability:</strong> Counts every dropped or discarded event under {@code correlate.*}.</p>
 *
 * @implNote Pending slots left open at {@link #finish()} are dropped, never flushed.
 * @since 0.1.0
 */
public final class CompactBlockCorrelationEngine implements EventCorrelator {
  private static final Logger log = LoggerFactory.getLogger(CompactBlockCorrelationEngine.class);

  private final MetricsPort metrics;
  private final CorrelationState state = new CorrelationState();

  /**
   * Creates an engine reporting to {@code metrics}.
   *
   * @param metrics metrics sink; must not be {@code null}
   */
  public CompactBlockCorrelationEngine(MetricsPort metrics) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Creates an engine that records no metrics.
   */
  public CompactBlockCorrelationEngine() {
    this(MetricsPort.NO_OP);
  }

  /**
   * Applies one event.
   *
   * @param event next event in log order
   * @throws PeerMismatchException if a send contradicts the pending transmission
   */
  @Override
  public void accept(CompactBlockEvent event) {
    Objects.requireNonNull(event, "event");
    if (event instanceof BlockReceived received) {
      onReceived(received);
    } else if (event instanceof BlockReconstructed reconstructed) {
      onReconstructed(reconstructed);
    } else if (event instanceof BlockAnnounced announced) {
      onSendOpened(announced.blockHash(), announced.peerId(), SendTrigger.ANNOUNCED);
    } else if (event instanceof BlockRequested requested) {
      onSendOpened(requested.blockHash(), requested.peerId(), SendTrigger.REQUESTED);
    } else if (event instanceof CompactBlockSent sent) {
      onSent(sent);
    } else if (event instanceof WindowSizeLogged window) {
      onWindowSize(window);
    } else {
      throw new IllegalArgumentException("Unsupported event type: " + event.getClass().getName());
    }
  }

  @Override
  public CorrelationResult finish() {
    if (state.hasPendingState()) {
      log.debug(
          "Dropping pending state at end of log: reconstruction={}, send={}, window={}",
          state.pendingReconstruction,
          state.pendingSend == null ? null : state.pendingSend.blockHash(),
          state.pendingWindow == null ? null : state.pendingWindow.blockHash());
    }
    Map<String, BlockReceiveRecord> receives = new LinkedHashMap<>();
    state.receives.forEach((hash, draft) -> receives.put(hash, draft.snapshot()));
    Map<String, List<BlockSendRecord>> sends = new LinkedHashMap<>();
    state.sends.forEach((hash, drafts) -> {
      List<BlockSendRecord> records = new ArrayList<>(drafts.size());
      for (SendDraft draft : drafts) {
        records.add(draft.snapshot());
      }
      sends.put(hash, records);
    });
    return new CorrelationResult(receives, sends);
  }

  private void onReceived(BlockReceived event) {
    String pending = state.pendingReconstruction;
    if (pending != null && !pending.equals(event.blockHash())) {
      state.receives.remove(pending);
      metrics.increment("correlate.receive.orphaned");
      log.info("Discarding block {} received without reconstruction before block {} at {}",
          pending, event.blockHash(), event.timestamp());
    }
    state.receives.put(
        event.blockHash(),
        new ReceiveDraft(event.blockHash(), event.timestamp(), event.compactBlockBytes()));
    state.pendingReconstruction = event.blockHash();
  }

  private void onReconstructed(BlockReconstructed event) {
    if (!event.blockHash().equals(state.pendingReconstruction)) {
      metrics.increment("correlate.reconstruction.unexpected");
      log.warn("Unexpected reconstruction of block {} at {} (pending: {}); skipping",
          event.blockHash(), event.timestamp(), state.pendingReconstruction);
      return;
    }
    state.receives.get(event.blockHash()).reconstructed(event);
    state.pendingReconstruction = null;
  }

  private void onSendOpened(String blockHash, long peerId, SendTrigger trigger) {
    if (!state.receives.containsKey(blockHash)) {
      metrics.increment("correlate.send.unknownBlock");
      log.debug("Ignoring {} of block {} to peer={} with no compact block receipt",
          trigger, blockHash, peerId);
      return;
    }
    if (state.pendingSend != null) {
      log.debug("Send of block {} to peer={} superseded before it was confirmed",
          state.pendingSend.blockHash(), state.pendingSend.peerId());
    }
    SendDraft draft = new SendDraft(blockHash, peerId, trigger);
    state.appendSend(draft);
    state.pendingSend = draft;
  }

  private void onSent(CompactBlockSent event) {
    SendDraft draft = state.pendingSend;
    if (draft == null) {
      metrics.increment("correlate.sent.unattributed");
      log.debug("Ignoring compact block send to peer={} at {} with no pending announcement",
          event.peerId(), event.timestamp());
      return;
    }
    if (draft.peerId() != event.peerId()) {
      state.withdrawSend(draft);
      state.pendingSend = null;
      throw new PeerMismatchException(draft.blockHash(), draft.peerId(), event.peerId(), event.timestamp());
    }
    draft.sent(event.timestamp(), event.bytes());
    state.pendingWindow = draft;
    state.pendingSend = null;
  }

  private void onWindowSize(WindowSizeLogged event) {
    SendDraft draft = state.pendingWindow;
    if (draft == null) {
      metrics.increment("correlate.window.unattributed");
      log.debug("Ignoring window size {} at {} with no pending send", event.maxSendBytes(), event.timestamp());
      return;
    }
    draft.windowSize(event.maxSendBytes());
    state.pendingWindow = null;
  }
}
