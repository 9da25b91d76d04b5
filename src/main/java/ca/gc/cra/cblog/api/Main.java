package ca.gc.cra.cblog.api;

import ca.gc.cra.cblog.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * cblog CLI dispatcher that routes to subcommands.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: cblog <parse|stats|filter> [options]";
  private static final String HELP_TEXT = """
      cblog compact block relay log analyzer

      Usage:
        cblog <command> [options]

      Commands:
        parse       Correlate a debug log and export received/sent tables
        stats       Correlate a debug log and print relay statistics
        filter      Print the log lines inside a timestamp window

      Run 'cblog <command> --help' for the options of a command.
      '--verbose <command> ...' raises cblog loggers to DEBUG before the command starts.
      """;

  private Main() {}

  /** Runs a command and exits with its {@link ExitCode}. */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    if (exit != ExitCode.SUCCESS) {
      log.debug("Exiting with {}: {}", exit.code(), exit.meaning());
    }
    System.exit(exit.code());
  }

  /**
   * Routes {@code args[0]} to the parse, stats or filter command, case-insensitively.
   *
   * @param args command name followed by its arguments
   * @return the command's exit status
   */
  static ExitCode run(String[] args) {
    String[] safeArgs = args == null ? new String[0] : args;
    if (safeArgs.length == 0) {
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    String command = safeArgs[0].trim().toLowerCase(Locale.ROOT);
    String[] delegateArgs = Arrays.copyOfRange(safeArgs, 1, safeArgs.length);

    return switch (command) {
      case "parse" -> ParseCli.run(delegateArgs);
      case "stats" -> StatsCli.run(delegateArgs);
      case "filter" -> FilterCli.run(delegateArgs);
      default -> dispatchGlobal(command, delegateArgs);
    };
  }

  private static ExitCode dispatchGlobal(String command, String[] rest) {
    Optional<CliInput.Switch> global = CliInput.Switch.lookup(command);
    if (global.isPresent() && global.get() == CliInput.Switch.HELP) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      CliPrinter.println("");
      CliPrinter.println("Exit codes:");
      CliPrinter.printLines(ExitCode.helpLines());
      return ExitCode.SUCCESS;
    }
    if (global.isPresent() && global.get() == CliInput.Switch.VERBOSE && rest.length > 0) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled before dispatching {}", rest[0]);
      return run(rest);
    }
    log.error("Unknown command: {}", command);
    CliPrinter.println(SUMMARY_USAGE);
    return ExitCode.INVALID_ARGS;
  }
}
