/**
 * <strong>Purpose:</strong> Correlated compact-block records handed to reports and exporters.
 * <p><strong>Concurrency:</strong> Immutable records; safe to share once a correlation pass finishes.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.cblog.domain.record;
