/**
 * <strong>Purpose:</strong> Line metadata parsing for node debug logs.
 * <p>A line has the shape {@code <timestamp> ([annotation] )* <body>}. {@link
 * ca.gc.cra.cblog.domain.line.LineTokenizer} splits it by position and {@link
 * ca.gc.cra.cblog.domain.line.MetadataDisambiguator} decides what each annotation is.</p>
 * <p><strong>Concurrency:</strong> All types are immutable or stateless.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.cblog.domain.line;
