package ca.gc.cra.cblog.domain.event;

/**
 * <strong>What:</strong> A typed event extracted from one classified log line.
 * <p><strong>Why:</strong> Each kind carries a fixed set of typed fields, resolved once at
 * classification time so the correlation engine never performs string lookups.</p>
 * <p><strong>Role:</strong> Domain value flowing from the line classifier to the correlation engine.</p>
 * <p><strong>Thread-safety:</strong> All implementations are immutable records.</p>
 *
 * @since 0.1.0
 * @see BlockReceived
 * @see BlockReconstructed
 * @see BlockAnnounced
 * @see BlockRequested
 * @see CompactBlockSent
 * @see WindowSizeLogged
 */
public interface CompactBlockEvent {
  /**
   * Returns the raw timestamp token of the line that produced the event.
   *
   * @return timestamp token; never {@code null}
   */
  String timestamp();

  /**
   * Returns the discriminator for this event.
   *
   * @return event kind
   */
  EventKind kind();
}
