/**
 * <strong>Purpose:</strong> Correlation of compact-block events into receive and send records.
 * <p><strong>Concurrency:</strong> The engine is confined to the thread running the pass; results
 * are immutable.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.cblog.application.correlate;
