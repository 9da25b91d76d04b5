package ca.gc.cra.cblog.application.port;

/**
 * Counters and histograms emitted while a log is parsed, classified and correlated.
 *
 * <p>Keys are dotted and grouped by stage:</p>
 * <ul>
 *   <li>{@code parse.lines.read}, {@code parse.lines.blank}, {@code parse.lines.malformed},
 *       {@code parse.lines.outsideWindow}</li>
 *   <li>{@code classify.event.<kind>} per recognised event, plus the byte-size histograms
 *       {@code classify.received.bytes}, {@code classify.sent.bytes} and
 *       {@code classify.window.bytes}</li>
 *   <li>{@code correlate.receive.orphaned}, {@code correlate.reconstruction.unexpected},
 *       {@code correlate.send.unknownBlock}, {@code correlate.sent.unattributed},
 *       {@code correlate.window.unattributed}</li>
 * </ul>
 *
 * <p>Implementations must accept calls from any thread.</p>
 *
 * @since 0.1.0
 */
public interface MetricsPort {
  /** Adds one to the counter {@code key}. */
  void increment(String key);

  /** Records {@code value} in the histogram {@code key}. */
  void observe(String key, long value);

  /** Discards everything; used by the filter command and by tests that do not inspect metrics. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
