/**
 * Line source adapters for files and in-memory buffers.
 *
 * @since 0.1.0
 */
package ca.gc.cra.cblog.infrastructure.source;
