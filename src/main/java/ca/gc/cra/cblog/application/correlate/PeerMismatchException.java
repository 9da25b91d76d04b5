package ca.gc.cra.cblog.application.correlate;

/**
 * Raised when a compact block send is logged for a different peer than the pending announcement or
 * request. The correlation pass cannot continue because its ordering assumption no longer holds.
 *
 * @since 0.1.0
 */
public final class PeerMismatchException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final String blockHash;
  private final long expectedPeer;
  private final long observedPeer;
  private final String timestamp;

  /**
   * Creates the exception.
   *
   * @param blockHash block of the pending transmission
   * @param expectedPeer peer named by the pending announcement or request
   * @param observedPeer peer named by the send line
   * @param timestamp timestamp of the send line
   */
  public PeerMismatchException(String blockHash, long expectedPeer, long observedPeer, String timestamp) {
    super("Compact block sent to peer=" + observedPeer + " at " + timestamp
        + " but block " + blockHash + " was pending for peer=" + expectedPeer);
    this.blockHash = blockHash;
    this.expectedPeer = expectedPeer;
    this.observedPeer = observedPeer;
    this.timestamp = timestamp;
  }

  public String blockHash() {
    return blockHash;
  }

  public long expectedPeer() {
    return expectedPeer;
  }

  public long observedPeer() {
    return observedPeer;
  }

  public String timestamp() {
    return timestamp;
  }
}
