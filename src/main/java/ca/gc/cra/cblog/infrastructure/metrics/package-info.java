/**
 * Metrics adapters that bridge {@link ca.gc.cra.cblog.application.port.MetricsPort} to OpenTelemetry
 * or discard updates.
 * <p><strong>Metrics:</strong> Publishes under {@code parse.*}, {@code classify.*} and
 * {@code correlate.*} namespaces.</p>
 */
package ca.gc.cra.cblog.infrastructure.metrics;
