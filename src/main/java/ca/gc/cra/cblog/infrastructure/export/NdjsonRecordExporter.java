package ca.gc.cra.cblog.infrastructure.export;

import ca.gc.cra.cblog.application.port.RecordExporter;
import ca.gc.cra.cblog.application.report.CompactBlockTables;
import ca.gc.cra.cblog.application.report.ReceivedRow;
import ca.gc.cra.cblog.application.report.SentRow;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * <strong>What:</strong> Writes the received and sent tables as newline-delimited JSON.
 * <p><strong>Role:</strong> {@link RecordExporter} selected by {@code format=ndjson}.</p>
 * <p><strong>Performance:</strong> Streams through a single {@link JsonGenerator} per file.</p>
 *
 * @implNote Keys match the CSV headers; absent values are written as JSON {@code null}.
 * @since 0.1.0
 */
public final class NdjsonRecordExporter implements RecordExporter {
  private final JsonFactory jsonFactory;

  /**
   * Creates an exporter with one JSON document per line.
   */
  public NdjsonRecordExporter() {
    this.jsonFactory = new JsonFactory();
    this.jsonFactory.setRootValueSeparator(null);
  }

  @Override
  public List<Path> export(CompactBlockTables tables, Path directory) throws IOException {
    Objects.requireNonNull(tables, "tables");
    Objects.requireNonNull(directory, "directory");
    Path received = directory.resolve(Columns.RECEIVED_TABLE + "." + extension());
    try (OutputStream out = Files.newOutputStream(received);
         JsonGenerator gen = jsonFactory.createGenerator(out)) {
      for (ReceivedRow row : tables.received()) {
        writeReceived(gen, row);
        gen.writeRaw('\n');
      }
    }
    Path sent = directory.resolve(Columns.SENT_TABLE + "." + extension());
    try (OutputStream out = Files.newOutputStream(sent);
         JsonGenerator gen = jsonFactory.createGenerator(out)) {
      for (SentRow row : tables.sent()) {
        writeSent(gen, row);
        gen.writeRaw('\n');
      }
    }
    return List.of(received, sent);
  }

  @Override
  public String extension() {
    return "ndjson";
  }

  private static void writeReceived(JsonGenerator gen, ReceivedRow row) throws IOException {
    List<String> keys = Columns.RECEIVED;
    gen.writeStartObject();
    gen.writeStringField(keys.get(0), row.blockHash());
    gen.writeStringField(keys.get(1), row.timeReceived());
    gen.writeStringField(keys.get(2), row.timeReconstructed());
    gen.writeNumberField(keys.get(3), row.receivedSize());
    gen.writeNumberField(keys.get(4), row.bytesMissing());
    gen.writeNumberField(keys.get(5), row.txMissingCount());
    gen.writeNumberField(keys.get(6), row.prefilledCount());
    gen.writeNumberField(keys.get(7), row.mempoolCount());
    gen.writeNumberField(keys.get(8), row.extraPoolCount());
    writeOptional(gen, keys.get(9), row.reconstructionNanos());
    gen.writeEndObject();
  }

  private static void writeSent(JsonGenerator gen, SentRow row) throws IOException {
    List<String> keys = Columns.SENT;
    gen.writeStartObject();
    gen.writeStringField(keys.get(0), row.blockHash());
    gen.writeNumberField(keys.get(1), row.peerId());
    gen.writeStringField(keys.get(2), row.trigger().name());
    gen.writeStringField(keys.get(3), row.timeSent());
    gen.writeNumberField(keys.get(4), row.tcpWindowSize());
    gen.writeNumberField(keys.get(5), row.receivedSize());
    gen.writeNumberField(keys.get(6), row.receivedBytesMissing());
    gen.writeNumberField(keys.get(7), row.receivedTxMissing());
    gen.writeNumberField(keys.get(8), row.sendSize());
    gen.writeNumberField(keys.get(9), row.prefillSize());
    writeOptional(gen, keys.get(10), row.windowBytesUsed());
    writeOptional(gen, keys.get(11), row.windowBytesAvailable());
    writeOptional(gen, keys.get(12), row.rttsWithoutPrefill());
    gen.writeEndObject();
  }

  private static void writeOptional(JsonGenerator gen, String key, OptionalLong value) throws IOException {
    if (value.isPresent()) {
      gen.writeNumberField(key, value.getAsLong());
    } else {
      gen.writeNullField(key);
    }
  }
}
