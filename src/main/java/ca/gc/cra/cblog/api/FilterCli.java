package ca.gc.cra.cblog.api;

import ca.gc.cra.cblog.application.port.MetricsPort;
import ca.gc.cra.cblog.config.CompositionRoot;
import ca.gc.cra.cblog.config.InputConfig;
import ca.gc.cra.cblog.logging.LoggingConfigurator;
import ca.gc.cra.cblog.validation.Paths;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prints the lines of a log whose timestamp falls inside {@code [from, to]}.
 *
 * @since 0.1.0
 */
public final class FilterCli {
  private static final Logger log = LoggerFactory.getLogger(FilterCli.class);
  private static final String SUMMARY_USAGE = "usage: filter in=LOG from=TS to=TS [config=YAML]";
  private static final String HELP_TEXT = """
      cblog filter

      Usage:
        filter in=debug.log from=2024-05-01T10:00:00Z to=2024-05-01T11:00:00Z

      Required:
        in=PATH                  Node debug log to read
        from=TIMESTAMP           Inclusive lower bound, compared as text
        to=TIMESTAMP             Inclusive upper bound, compared as text

      Optional:
        config=PATH              YAML configuration with common/filter sections
        --verbose                Enable DEBUG logging
        --help                   Show this message
      """;

  private FilterCli() {}

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

    CommandSupport.Resolution resolution = CommandSupport.resolve("filter", input, SUMMARY_USAGE, log);
    if (resolution.failed()) {
      return resolution.failure();
    }
    InputConfig config;
    Path inputFile;
    try {
      config = InputConfig.fromMap(resolution.config());
      inputFile = Paths.requireReadableFile(config.input());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid filter arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    try (CompositionRoot root = new CompositionRoot(MetricsPort.NO_OP)) {
      long kept;
      try {
        kept = root.filterLogUseCase(config.window()).run(root.openSource(inputFile), CliPrinter.lineSink());
      } finally {
        CliPrinter.flush();
      }
      log.debug("Filter kept {} lines from {}", kept, inputFile);
      return ExitCode.SUCCESS;
    } catch (Exception ex) {
      return CommandSupport.failure("filter", inputFile, ex, log);
    }
  }
}
