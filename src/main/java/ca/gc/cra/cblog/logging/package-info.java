/**
 * <strong>Purpose:</strong> Logging utilities that tune verbosity and bound quoted log content.
 *
 * @since 0.1.0
 */
package ca.gc.cra.cblog.logging;
