/**
 * <strong>Purpose:</strong> Configuration loading, merging and wiring for the cblog commands.
 * <p>Precedence is CLI over YAML over {@link ca.gc.cra.cblog.config.DefaultsForMode}; typed records
 * ({@link ca.gc.cra.cblog.config.ParseConfig}, {@link ca.gc.cra.cblog.config.InputConfig}) are built
 * from the merged flat map.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.cblog.config;
