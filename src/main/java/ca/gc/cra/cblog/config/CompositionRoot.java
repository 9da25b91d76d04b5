package ca.gc.cra.cblog.config;

import ca.gc.cra.cblog.application.classify.EventPatternLoader;
import ca.gc.cra.cblog.application.classify.EventPatternTable;
import ca.gc.cra.cblog.application.classify.LineClassifier;
import ca.gc.cra.cblog.application.correlate.CompactBlockCorrelationEngine;
import ca.gc.cra.cblog.application.pipeline.FilterLogUseCase;
import ca.gc.cra.cblog.application.pipeline.ParseLogUseCase;
import ca.gc.cra.cblog.application.port.LineSource;
import ca.gc.cra.cblog.application.port.MetricsPort;
import ca.gc.cra.cblog.application.port.RecordExporter;
import ca.gc.cra.cblog.domain.line.LogLineParser;
import ca.gc.cra.cblog.domain.line.TimeWindow;
import ca.gc.cra.cblog.infrastructure.export.CsvRecordExporter;
import ca.gc.cra.cblog.infrastructure.export.NdjsonRecordExporter;
import ca.gc.cra.cblog.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.cblog.infrastructure.source.FileLineSource;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Wires cblog use cases to concrete adapters.
 * <p><strong>Role:</strong> Single place where configuration becomes runnable pipelines.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Load an override event pattern table or fall back to the built-in one.</li>
 *   <li>Build parse and filter use cases with a fresh correlation engine per pass.</li>
 *   <li>Select the exporter for an {@link ExportFormat}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; build once per CLI invocation.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final MetricsPort metrics;
  private final EventPatternLoader patternLoader = new EventPatternLoader();

  /**
   * Creates a composition root that reports through {@code metrics}.
   *
   * @param metrics metrics adapter; an {@link OpenTelemetryMetricsAdapter} is closed by {@link #close()}
   */
  public CompositionRoot(MetricsPort metrics) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Returns the metrics adapter shared by every use case.
   *
   * @return metrics port
   */
  public MetricsPort metrics() {
    return metrics;
  }

  /**
   * Builds the classifier for the optional pattern override.
   *
   * @param patterns pattern file; empty selects the built-in table
   * @return classifier
   * @throws IOException if the pattern file cannot be read
   * @throws IllegalArgumentException if the pattern file is invalid
   */
  public LineClassifier lineClassifier(Optional<Path> patterns) throws IOException {
    if (patterns.isEmpty()) {
      return new LineClassifier(EventPatternTable.defaults());
    }
    EventPatternTable table = patternLoader.load(patterns.get());
    log.info("Loaded {} event patterns from {}", table.entries().size(), patterns.get());
    return new LineClassifier(table);
  }

  /**
   * Builds the parse pipeline.
   *
   * @param window inclusive timestamp window
   * @param patterns optional pattern file
   * @return use case running one correlation pass per invocation
   * @throws IOException if the pattern file cannot be read
   */
  public ParseLogUseCase parseLogUseCase(TimeWindow window, Optional<Path> patterns) throws IOException {
    return new ParseLogUseCase(
        new LogLineParser(),
        lineClassifier(patterns),
        () -> new CompactBlockCorrelationEngine(metrics),
        metrics,
        window);
  }

  /**
   * Builds the timestamp filter.
   *
   * @param window inclusive timestamp window
   * @return filter use case
   */
  public FilterLogUseCase filterLogUseCase(TimeWindow window) {
    return new FilterLogUseCase(window);
  }

  /**
   * Selects the exporter for a format.
   *
   * @param format export format
   * @return exporter
   */
  public RecordExporter recordExporter(ExportFormat format) {
    return switch (Objects.requireNonNull(format, "format")) {
      case CSV -> new CsvRecordExporter();
      case NDJSON -> new NdjsonRecordExporter();
    };
  }

  /**
   * Opens a log file as a line source.
   *
   * @param input log file
   * @return open source; the caller owns it
   * @throws IOException if the file cannot be opened
   */
  public LineSource openSource(Path input) throws IOException {
    return FileLineSource.open(input);
  }

  /**
   * Flushes and releases the OpenTelemetry adapter when one is in use.
   */
  @Override
  public void close() {
    if (metrics instanceof OpenTelemetryMetricsAdapter otel) {
      otel.close();
    }
  }
}
