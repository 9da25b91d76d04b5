/**
 * Ports separating the analysis pipeline from line sources, exporters and metrics backends.
 *
 * @since 0.1.0
 */
package ca.gc.cra.cblog.application.port;
