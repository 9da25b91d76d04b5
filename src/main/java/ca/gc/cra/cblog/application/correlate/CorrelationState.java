package ca.gc.cra.cblog.application.correlate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * All mutable state of one correlation pass: the two record maps and the three single-item
 * pending slots. Only {@link CompactBlockCorrelationEngine} reads or writes it.
 *
 * <p>Invariants: {@code pendingReconstruction}, when set, is a key of {@code receives};
 * {@code pendingSend} and {@code pendingWindow}, when set, are members of their hash's send list;
 * {@code pendingWindow} has already been sent.</p>
 */
final class CorrelationState {
  final Map<String, ReceiveDraft> receives = new LinkedHashMap<>();
  final Map<String, List<SendDraft>> sends = new LinkedHashMap<>();
  String pendingReconstruction;
  SendDraft pendingSend;
  SendDraft pendingWindow;

  void appendSend(SendDraft draft) {
    sends.computeIfAbsent(draft.blockHash(), ignored -> new ArrayList<>()).add(draft);
  }

  void withdrawSend(SendDraft draft) {
    List<SendDraft> list = sends.get(draft.blockHash());
    if (list == null) {
      return;
    }
    list.remove(draft);
    if (list.isEmpty()) {
      sends.remove(draft.blockHash());
    }
  }

  boolean hasPendingState() {
    return pendingReconstruction != null || pendingSend != null || pendingWindow != null;
  }
}
