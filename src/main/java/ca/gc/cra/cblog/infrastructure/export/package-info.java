/**
 * <strong>Purpose:</strong> File exporters for the derived received and sent tables.
 * <p>Each exporter writes {@code received.<ext>} and {@code sent.<ext>} into the target directory.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.cblog.infrastructure.export;
