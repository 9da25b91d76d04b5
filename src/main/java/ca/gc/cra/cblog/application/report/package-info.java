/**
 * <strong>Purpose:</strong> Derived tables and summary statistics over correlated records.
 * <p>Nothing here mutates a {@link ca.gc.cra.cblog.application.correlate.CorrelationResult}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.cblog.application.report;
