package ca.gc.cra.cblog.api;

import ca.gc.cra.cblog.application.pipeline.ParseReport;
import ca.gc.cra.cblog.application.port.RecordExporter;
import ca.gc.cra.cblog.application.report.CompactBlockTables;
import ca.gc.cra.cblog.config.CompositionRoot;
import ca.gc.cra.cblog.config.ParseConfig;
import ca.gc.cra.cblog.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.cblog.logging.LoggingConfigurator;
import ca.gc.cra.cblog.validation.Paths;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Correlates a node debug log and exports the received and sent tables.
 *
 * @since 0.1.0
 */
public final class ParseCli {
  private static final Logger log = LoggerFactory.getLogger(ParseCli.class);
  private static final String SUMMARY_USAGE =
      "usage: parse in=LOG [out=DIR] [format=csv|ndjson] [from=TS] [to=TS] [patterns=YAML] "
          + "[config=YAML] [--dry-run] [--allow-overwrite] [metricsExporter=otlp|none]";
  private static final String HELP_TEXT = """
      cblog parse

      Usage:
        parse in=debug.log out=./cblog-out [options]

      Required:
        in=PATH                  Node debug log to read

      Optional:
        out=PATH                 Export directory (default ./cblog-out)
        format=csv|ndjson        Export format (default csv)
        from=TIMESTAMP           Skip lines whose timestamp sorts before this value
        to=TIMESTAMP             Skip lines whose timestamp sorts after this value
        patterns=PATH            YAML event pattern table replacing the built-in one
        config=PATH              YAML configuration with common/parse sections
        --dry-run                Validate inputs and print plan without parsing
        --allow-overwrite        Permit writing into a non-empty export directory
        metricsExporter=otlp|none  Configure metrics exporter (default none)
        otelEndpoint=URL           OTLP metrics endpoint when exporter=otlp
        otelResourceAttributes=K=V Comma-separated OTel resource attributes
        --verbose                Enable DEBUG logging
        --help                   Show this message

      Output:
        received.<ext> and sent.<ext> in the export directory.
      """;

  private ParseCli() {}

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
      log.debug("Verbose logging enabled for parse CLI");
    }

    CommandSupport.Resolution resolution = CommandSupport.resolve("parse", input, SUMMARY_USAGE, log);
    if (resolution.failed()) {
      return resolution.failure();
    }
    boolean dryRun = CommandSupport.switchOn(input, CliInput.Switch.DRY_RUN, resolution.config(), "dryRun");
    boolean allowOverwrite = CommandSupport.switchOn(
        input, CliInput.Switch.ALLOW_OVERWRITE, resolution.config(), "allowOverwrite");

    ParseConfig config;
    Path inputFile;
    Path outputDir;
    Optional<Path> patterns;
    try {
      config = ParseConfig.fromMap(resolution.config());
      inputFile = Paths.requireReadableFile(config.input());
      patterns = config.patterns().map(Paths::requireReadableFile);
      outputDir = Paths.prepareExportDirectory(config.outputDirectory(), !dryRun, allowOverwrite);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid parse arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    if (dryRun) {
      CliPrinter.printLines(
          "Parse dry-run: no files will be written.",
          " Input log        : " + inputFile,
          " Export directory : " + outputDir,
          " Format           : " + config.format(),
          " From             : " + config.window().from().orElse("<open>"),
          " To               : " + config.window().to().orElse("<open>"),
          " Event patterns   : " + patterns.map(Path::toString).orElse("<built-in>"),
          " Allow overwrite  : " + allowOverwrite,
          " Re-run without --dry-run to parse the log.");
      return ExitCode.SUCCESS;
    }

    try (CompositionRoot root = new CompositionRoot(new OpenTelemetryMetricsAdapter())) {
      ParseReport report = root.parseLogUseCase(config.window(), patterns).run(root.openSource(inputFile));
      CompactBlockTables tables = CompactBlockTables.from(report.result());
      RecordExporter exporter = root.recordExporter(config.format());
      List<Path> written = exporter.export(tables, outputDir);
      log.info("Exported {} received and {} sent rows to {}",
          tables.received().size(), tables.sent().size(), outputDir);
      CliPrinter.printLines(
          "Lines read       : " + report.linesRead(),
          "Malformed lines  : " + report.malformedLines(),
          "Events           : " + report.eventsClassified(),
          "Received rows    : " + tables.received().size(),
          "Sent rows        : " + tables.sent().size());
      for (Path file : written) {
        CliPrinter.println("Wrote " + file);
      }
      return ExitCode.SUCCESS;
    } catch (Exception ex) {
      return CommandSupport.failure("parse", inputFile, ex, log);
    }
  }
}
