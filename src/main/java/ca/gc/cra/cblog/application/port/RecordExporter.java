package ca.gc.cra.cblog.application.port;

import ca.gc.cra.cblog.application.report.CompactBlockTables;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * <strong>What:</strong> Port writing the derived receive and send tables to persistent files.
 * <p><strong>Role:</strong> Implemented by the CSV and NDJSON exporters.</p>
 *
 * @since 0.1.0
 */
public interface RecordExporter {
  /**
   * Writes both tables into {@code directory}.
   *
   * @param tables derived tables
   * @param directory existing, writable directory
   * @return files written, received table first
   * @throws IOException if writing fails
   */
  List<Path> export(CompactBlockTables tables, Path directory) throws IOException;

  /**
   * File extension used by this exporter, without the dot.
   *
   * @return extension such as {@code csv}
   */
  String extension();
}
