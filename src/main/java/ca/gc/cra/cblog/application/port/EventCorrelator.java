package ca.gc.cra.cblog.application.port;

import ca.gc.cra.cblog.application.correlate.CorrelationResult;
import ca.gc.cra.cblog.domain.event.CompactBlockEvent;

/**
 * <strong>What:</strong> Port folding classified events into correlated records.
 * <p><strong>Role:</strong> Implemented by {@code CompactBlockCorrelationEngine}; driven by the parse use case.</p>
 * <p><strong>Thread-safety:</strong> Implementations are single-threaded and order-sensitive.</p>
 *
 * @since 0.1.0
 */
public interface EventCorrelator {
  /**
   * Consumes the next event in log order.
   *
   * @param event classified event; must not be {@code null}
   */
  void accept(CompactBlockEvent event);

  /**
   * Ends the pass, discarding unfinished pending state.
   *
   * @return immutable snapshot of every committed record
   */
  CorrelationResult finish();
}
