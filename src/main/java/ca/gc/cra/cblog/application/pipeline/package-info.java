/**
 * <strong>Purpose:</strong> Use cases that drive a log through parsing, classification and correlation.
 * <p><strong>Concurrency:</strong> Each pass is sequential; lines are consumed strictly in order.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.cblog.application.pipeline;
