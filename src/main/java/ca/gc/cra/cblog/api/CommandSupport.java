package ca.gc.cra.cblog.api;

import ca.gc.cra.cblog.application.correlate.PeerMismatchException;
import ca.gc.cra.cblog.config.ConfigMerger;
import ca.gc.cra.cblog.config.DefaultsForMode;
import ca.gc.cra.cblog.config.YamlConfigLoader;
import ca.gc.cra.cblog.domain.line.LogGrammarException;
import ca.gc.cra.cblog.logging.Logs;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * Configuration resolution and failure mapping shared by the parse, stats and filter commands.
 */
final class CommandSupport {
  private static final int LINE_EXCERPT_LENGTH = 256;
  private static final String CONFIG_OPTION = "config";

  private CommandSupport() {
    // Utility class
  }

  /**
   * Builds the effective option map for {@code mode}: command-line options win over the
   * {@code config=} YAML file, which wins over built-in defaults. Telemetry options are applied and
   * removed from the result.
   */
  static Resolution resolve(String mode, CliInput input, String usage, Logger log) {
    if (!input.unrecognized().isEmpty()) {
      log.error("Unknown {} switch: {}", mode, String.join(", ", input.unrecognized()));
      CliPrinter.println(usage);
      return Resolution.failed(ExitCode.INVALID_ARGS);
    }
    Map<String, String> options;
    try {
      options = input.options();
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(usage);
      return Resolution.failed(ExitCode.INVALID_ARGS);
    }

    Optional<Map<String, String>> fromYaml = Optional.empty();
    String configFile = options.remove(CONFIG_OPTION);
    if (configFile != null) {
      Path yaml = Path.of(configFile);
      if (!Files.isRegularFile(yaml)) {
        log.error("Configuration file does not exist: {}", yaml);
        CliPrinter.println(usage);
        return Resolution.failed(ExitCode.INVALID_ARGS);
      }
      try {
        fromYaml = YamlConfigLoader.load(yaml, mode);
      } catch (IllegalArgumentException ex) {
        log.error("Invalid YAML configuration {}: {}", yaml, ex.getMessage());
        return Resolution.failed(ExitCode.CONFIG_ERROR);
      } catch (IOException ex) {
        log.error("Unable to read configuration file {}", yaml, ex);
        return Resolution.failed(ExitCode.IO_ERROR);
      }
    }

    try {
      Map<String, String> effective = new LinkedHashMap<>(ConfigMerger.buildEffectiveConfig(
          mode, fromYaml, options, DefaultsForMode.asFlatMap(mode), log::warn));
      TelemetryConfigurator.apply(effective);
      return new Resolution(effective, null);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid {} arguments: {}", mode, ex.getMessage());
      CliPrinter.println(usage);
      return Resolution.failed(ExitCode.INVALID_ARGS);
    }
  }

  /**
   * A switch is on when given on the command line or when the effective configuration sets
   * {@code configKey} to {@code true}.
   */
  static boolean switchOn(CliInput input, CliInput.Switch flag, Map<String, String> config, String configKey) {
    if (input.has(flag)) {
      return true;
    }
    String value = config.get(configKey);
    return value != null && Boolean.parseBoolean(value.trim());
  }

  /**
   * Maps a failure raised while running a pass to an exit code, logging it once.
   */
  static ExitCode failure(String command, Path input, Exception ex, Logger log) {
    if (ex instanceof LogGrammarException grammar) {
      log.error("{} aborted: {} in line: {}", command, grammar.getMessage(),
          Logs.excerpt(grammar.line(), LINE_EXCERPT_LENGTH));
      return ExitCode.INVALID_LOG;
    }
    if (ex instanceof NumberFormatException number) {
      log.error("{} aborted: event field out of range: {}", command, number.getMessage());
      return ExitCode.INVALID_LOG;
    }
    if (ex instanceof PeerMismatchException mismatch) {
      log.error("{} aborted: {}", command, mismatch.getMessage());
      return ExitCode.INVARIANT_VIOLATION;
    }
    if (ex instanceof IllegalArgumentException) {
      log.error("{} configuration error: {}", command, ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    }
    if (ex instanceof IOException) {
      log.error("{} I/O failure while processing {}", command, input, ex);
      return ExitCode.IO_ERROR;
    }
    log.error("Unexpected failure in {}", command, ex);
    return ExitCode.RUNTIME_FAILURE;
  }

  record Resolution(Map<String, String> config, ExitCode failure) {
    static Resolution failed(ExitCode code) {
      return new Resolution(Map.of(), code);
    }

    boolean failed() {
      return failure != null;
    }
  }
}
