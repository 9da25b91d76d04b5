package ca.gc.cra.cblog.infrastructure.export;

import ca.gc.cra.cblog.application.port.RecordExporter;
import ca.gc.cra.cblog.application.report.CompactBlockTables;
import ca.gc.cra.cblog.application.report.ReceivedRow;
import ca.gc.cra.cblog.application.report.SentRow;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * <strong>What:</strong> Writes the received and sent tables as RFC 4180 CSV files.
 * <p><strong>Role:</strong> {@link RecordExporter} selected by {@code format=csv}.</p>
 * <p><strong>Thread-safety:</strong> Stateless; concurrent exports must target different directories.</p>
 *
 * @implNote Absent values are written as empty cells. Existing files are truncated.
 * @since 0.1.0
 */
public final class CsvRecordExporter implements RecordExporter {

  @Override
  public List<Path> export(CompactBlockTables tables, Path directory) throws IOException {
    Objects.requireNonNull(tables, "tables");
    Objects.requireNonNull(directory, "directory");
    Path received = directory.resolve(Columns.RECEIVED_TABLE + "." + extension());
    try (BufferedWriter out = Files.newBufferedWriter(received, StandardCharsets.UTF_8)) {
      writeRow(out, Columns.RECEIVED);
      for (ReceivedRow row : tables.received()) {
        writeRow(out, cells(row));
      }
    }
    Path sent = directory.resolve(Columns.SENT_TABLE + "." + extension());
    try (BufferedWriter out = Files.newBufferedWriter(sent, StandardCharsets.UTF_8)) {
      writeRow(out, Columns.SENT);
      for (SentRow row : tables.sent()) {
        writeRow(out, cells(row));
      }
    }
    return List.of(received, sent);
  }

  @Override
  public String extension() {
    return "csv";
  }

  private static List<String> cells(ReceivedRow row) {
    List<String> cells = new ArrayList<>(Columns.RECEIVED.size());
    cells.add(row.blockHash());
    cells.add(row.timeReceived());
    cells.add(row.timeReconstructed());
    cells.add(Long.toString(row.receivedSize()));
    cells.add(Long.toString(row.bytesMissing()));
    cells.add(Long.toString(row.txMissingCount()));
    cells.add(Long.toString(row.prefilledCount()));
    cells.add(Long.toString(row.mempoolCount()));
    cells.add(Long.toString(row.extraPoolCount()));
    cells.add(optional(row.reconstructionNanos()));
    return cells;
  }

  private static List<String> cells(SentRow row) {
    List<String> cells = new ArrayList<>(Columns.SENT.size());
    cells.add(row.blockHash());
    cells.add(Long.toString(row.peerId()));
    cells.add(row.trigger().name());
    cells.add(row.timeSent());
    cells.add(Long.toString(row.tcpWindowSize()));
    cells.add(Long.toString(row.receivedSize()));
    cells.add(Long.toString(row.receivedBytesMissing()));
    cells.add(Long.toString(row.receivedTxMissing()));
    cells.add(Long.toString(row.sendSize()));
    cells.add(Long.toString(row.prefillSize()));
    cells.add(optional(row.windowBytesUsed()));
    cells.add(optional(row.windowBytesAvailable()));
    cells.add(optional(row.rttsWithoutPrefill()));
    return cells;
  }

  private static void writeRow(BufferedWriter out, List<String> cells) throws IOException {
    for (int i = 0; i < cells.size(); i++) {
      if (i > 0) {
        out.write(',');
      }
      out.write(escape(cells.get(i)));
    }
    out.write("\r\n");
  }

  static String escape(String value) {
    if (value == null) {
      return "";
    }
    boolean quote = false;
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      if (c == ',' || c == '"' || c == '\n' || c == '\r') {
        quote = true;
        break;
      }
    }
    if (!quote) {
      return value;
    }
    return '"' + value.replace("\"", "\"\"") + '"';
  }

  private static String optional(OptionalLong value) {
    return value.isPresent() ? Long.toString(value.getAsLong()) : "";
  }
}
