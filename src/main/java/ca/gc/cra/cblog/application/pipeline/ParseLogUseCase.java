package ca.gc.cra.cblog.application.pipeline;

import ca.gc.cra.cblog.application.classify.LineClassifier;
import ca.gc.cra.cblog.application.port.EventCorrelator;
import ca.gc.cra.cblog.application.port.LineSource;
import ca.gc.cra.cblog.application.port.MetricsPort;
import ca.gc.cra.cblog.domain.event.BlockReceived;
import ca.gc.cra.cblog.domain.event.CompactBlockEvent;
import ca.gc.cra.cblog.domain.event.CompactBlockSent;
import ca.gc.cra.cblog.domain.event.EventKind;
import ca.gc.cra.cblog.domain.event.WindowSizeLogged;
import ca.gc.cra.cblog.domain.line.LogLine;
import ca.gc.cra.cblog.domain.line.LogLineParser;
import ca.gc.cra.cblog.domain.line.MalformedLineException;
import ca.gc.cra.cblog.domain.line.TimeWindow;
import ca.gc.cra.cblog.domain.line.TokenizedLine;
import ca.gc.cra.cblog.logging.Logs;
import java.io.IOException;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Reads a node debug log and correlates its compact-block events.
 * <p><strong>Why:</strong> Ties the line parser, classifier and correlation engine into one ordered pass.</p>
 * <p><strong>Role:</strong> Application-layer use case behind the {@code parse} and {@code stats} commands.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Skip blank lines, malformed lines and lines outside the time window.</li>
 *   <li>Let annotation grammar violations and peer mismatches abort the pass.</li>
 *   <li>Count lines and events under {@code parse.*} and {@code classify.*}; observe byte sizes.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Each {@link #run(LineSource)} uses a fresh correlator; a single
 * instance may run passes sequentially.</p>
 * <p><strong>Observability:</strong> Sets MDC key {@code cblog.line} to the current line number.</p>
 *
 * @since 0.1.0
 */
public final class ParseLogUseCase {
  private static final Logger log = LoggerFactory.getLogger(ParseLogUseCase.class);
  private static final int LINE_EXCERPT_LENGTH = 200;

  private final LogLineParser parser;
  private final LineClassifier classifier;
  private final Supplier<EventCorrelator> correlatorFactory;
  private final MetricsPort metrics;
  private final TimeWindow window;

  /**
   * Creates the use case.
   *
   * @param parser line parser; must not be {@code null}
   * @param classifier event classifier; must not be {@code null}
   * @param correlatorFactory creates one correlator per pass; must not be {@code null}
   * @param metrics metrics sink; must not be {@code null}
   * @param window lines outside this window are skipped; must not be {@code null}
   */
  public ParseLogUseCase(
      LogLineParser parser,
      LineClassifier classifier,
      Supplier<EventCorrelator> correlatorFactory,
      MetricsPort metrics,
      TimeWindow window) {
    this.parser = Objects.requireNonNull(parser, "parser");
    this.classifier = Objects.requireNonNull(classifier, "classifier");
    this.correlatorFactory = Objects.requireNonNull(correlatorFactory, "correlatorFactory");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.window = Objects.requireNonNull(window, "window");
  }

  /**
   * Consumes {@code source} to exhaustion and closes it.
   *
   * @param source line source
   * @return correlated records and line accounting
   * @throws IOException if reading fails
   * @throws ca.gc.cra.cblog.domain.line.LogGrammarException if an annotation violates the grammar
   * @throws ca.gc.cra.cblog.application.correlate.PeerMismatchException if a send contradicts the pending transmission
   */
  public ParseReport run(LineSource source) throws IOException {
    Objects.requireNonNull(source, "source");
    EventCorrelator correlator = Objects.requireNonNull(correlatorFactory.get(), "correlator");
    Map<EventKind, Long> eventCounts = new EnumMap<>(EventKind.class);
    long linesRead = 0;
    long blank = 0;
    long malformed = 0;
    long outside = 0;
    try (LineSource lines = source) {
      Optional<String> next;
      while ((next = lines.nextLine()).isPresent()) {
        linesRead++;
        metrics.increment("parse.lines.read");
        String raw = next.get();
        if (raw.isBlank()) {
          blank++;
          metrics.increment("parse.lines.blank");
          continue;
        }
        MDC.put("cblog.line", Long.toString(linesRead));
        TokenizedLine tokens;
        try {
          tokens = parser.tokenize(raw);
        } catch (MalformedLineException ex) {
          malformed++;
          metrics.increment("parse.lines.malformed");
          log.warn("Skipping malformed line {}: {}", linesRead, Logs.excerpt(ex.line(), LINE_EXCERPT_LENGTH));
          continue;
        }
        if (!window.contains(tokens.timestamp())) {
          outside++;
          metrics.increment("parse.lines.outsideWindow");
          continue;
        }
        LogLine line = parser.interpret(tokens);
        Optional<CompactBlockEvent> event = classifier.classify(line);
        if (event.isPresent()) {
          EventKind kind = event.get().kind();
          eventCounts.merge(kind, 1L, Long::sum);
          metrics.increment("classify.event." + kind.metricName());
          observeSize(event.get());
          correlator.accept(event.get());
        }
      }
    } finally {
      MDC.remove("cblog.line");
    }
    ParseReport report = new ParseReport(correlator.finish(), linesRead, blank, malformed, outside, eventCounts);
    log.info(
        "Parsed {} lines ({} malformed, {} outside window); {} events, {} blocks received, {} sends",
        linesRead,
        malformed,
        outside,
        report.eventsClassified(),
        report.result().receives().size(),
        report.result().sendCount());
    return report;
  }

  private void observeSize(CompactBlockEvent event) {
    if (event instanceof BlockReceived received) {
      metrics.observe("classify.received.bytes", received.compactBlockBytes());
    } else if (event instanceof CompactBlockSent sent) {
      metrics.observe("classify.sent.bytes", sent.bytes());
    } else if (event instanceof WindowSizeLogged window) {
      metrics.observe("classify.window.bytes", window.maxSendBytes());
    }
  }
}
