/**
 * <strong>Purpose:</strong> Command-line entry points for the cblog analyzer.
 * <p>{@link ca.gc.cra.cblog.api.Main} dispatches to {@code parse}, {@code stats} and {@code filter}.
 * Arguments are {@code key=value} pairs plus flags; user-facing output goes through
 * {@link ca.gc.cra.cblog.api.CliPrinter} and diagnostics through SLF4J.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.cblog.api;
