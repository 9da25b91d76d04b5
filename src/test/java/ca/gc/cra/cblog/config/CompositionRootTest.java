package ca.gc.cra.cblog.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.cblog.application.classify.LineClassifier;
import ca.gc.cra.cblog.application.pipeline.ParseReport;
import ca.gc.cra.cblog.application.port.RecordingMetricsPort;
import ca.gc.cra.cblog.domain.line.TimeWindow;
import ca.gc.cra.cblog.infrastructure.export.CsvRecordExporter;
import ca.gc.cra.cblog.infrastructure.export.NdjsonRecordExporter;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CompositionRootTest {
  @TempDir Path tempDir;

  @Test
  void selectsExporterByFormat() {
    try (CompositionRoot root = new CompositionRoot(new RecordingMetricsPort())) {
      assertInstanceOf(CsvRecordExporter.class, root.recordExporter(ExportFormat.CSV));
      assertInstanceOf(NdjsonRecordExporter.class, root.recordExporter(ExportFormat.NDJSON));
    }
  }

  @Test
  void patternOverrideReplacesBuiltInTable() throws Exception {
    Path patterns = Path.of(getClass().getResource("/fixtures/patterns.yaml").toURI());
    try (CompositionRoot root = new CompositionRoot(new RecordingMetricsPort())) {
      LineClassifier classifier = root.lineClassifier(Optional.of(patterns));

      assertTrue(classifier.classify("T1", "net", "sending cmpctblock (120 bytes) peer=7").isEmpty());
      assertTrue(classifier.classify("T1", "net", "- Max send per-rtt: 10 bytes").isPresent());
    }
  }

  @Test
  void missingPatternFileFails() {
    try (CompositionRoot root = new CompositionRoot(new RecordingMetricsPort())) {
      assertThrows(IOException.class, () -> root.lineClassifier(Optional.of(tempDir.resolve("absent.yaml"))));
    }
  }

  @Test
  void parsePipelineReportsThroughSharedMetrics() throws Exception {
    Path log = Path.of(getClass().getResource("/fixtures/compactblocks.log").toURI());
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    try (CompositionRoot root = new CompositionRoot(metrics)) {
      ParseReport report = root.parseLogUseCase(TimeWindow.unbounded(), Optional.empty()).run(root.openSource(log));

      assertEquals(3, report.result().receives().size());
      assertEquals(4, metrics.count("classify.event.received"));
    }
  }
}
