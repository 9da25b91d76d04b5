/**
 * <strong>Purpose:</strong> Category-bucketed pattern table and the pure line classifier.
 * <p><strong>Pipeline role:</strong> Sits between line parsing and correlation.</p>
 * <p><strong>Concurrency:</strong> Immutable tables and stateless classifier.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.cblog.application.classify;
