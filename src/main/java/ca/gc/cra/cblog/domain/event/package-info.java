/**
 * Typed compact-block relay events produced by the line classifier.
 *
 * @since 0.1.0
 */
package ca.gc.cra.cblog.domain.event;
