package ca.gc.cra.cblog.api;

import ca.gc.cra.cblog.application.pipeline.ParseReport;
import ca.gc.cra.cblog.application.report.CompactBlockStats;
import ca.gc.cra.cblog.application.report.CompactBlockTables;
import ca.gc.cra.cblog.application.report.StatsCalculator;
import ca.gc.cra.cblog.application.report.StatsReportPrinter;
import ca.gc.cra.cblog.config.CompositionRoot;
import ca.gc.cra.cblog.config.InputConfig;
import ca.gc.cra.cblog.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.cblog.logging.LoggingConfigurator;
import ca.gc.cra.cblog.validation.Paths;
import java.nio.file.Path;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Correlates a node debug log and prints compact block relay statistics.
 *
 * @since 0.1.0
 */
public final class StatsCli {
  private static final Logger log = LoggerFactory.getLogger(StatsCli.class);
  private static final String SUMMARY_USAGE =
      "usage: stats in=LOG [from=TS] [to=TS] [patterns=YAML] [config=YAML]";
  private static final String HELP_TEXT = """
      cblog stats

      Usage:
        stats in=debug.log [options]

      Required:
        in=PATH                  Node debug log to read

      Optional:
        from=TIMESTAMP           Skip lines whose timestamp sorts before this value
        to=TIMESTAMP             Skip lines whose timestamp sorts after this value
        patterns=PATH            YAML event pattern table replacing the built-in one
        config=PATH              YAML configuration with common/stats sections
        metricsExporter=otlp|none  Configure metrics exporter (default none)
        --verbose                Enable DEBUG logging
        --help                   Show this message
      """;

  private StatsCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    CommandSupport.Resolution resolution = CommandSupport.resolve("stats", input, SUMMARY_USAGE, log);
    if (resolution.failed()) {
      return resolution.failure();
    }
    InputConfig config;
    Path inputFile;
    Optional<Path> patterns;
    try {
      config = InputConfig.fromMap(resolution.config());
      inputFile = Paths.requireReadableFile(config.input());
      patterns = config.patterns().map(Paths::requireReadableFile);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid stats arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    try (CompositionRoot root = new CompositionRoot(new OpenTelemetryMetricsAdapter())) {
      ParseReport report = root.parseLogUseCase(config.window(), patterns).run(root.openSource(inputFile));
      CompactBlockStats stats = new StatsCalculator().compute(CompactBlockTables.from(report.result()));
      CliPrinter.printLines(new StatsReportPrinter().render(stats));
      return ExitCode.SUCCESS;
    } catch (Exception ex) {
      return CommandSupport.failure("stats", inputFile, ex, log);
    }
  }
}
