package ca.gc.cra.cblog.domain.record;

/**
 * What opened a send record: an unsolicited announcement or a peer's getdata request.
 *
 * @since 0.1.0
 */
public enum SendTrigger {
  /** High-bandwidth announcement of a freshly validated block. */
  ANNOUNCED,
  /** Response to a peer's getdata for a compact block. */
  REQUESTED
}
