package ca.gc.cra.cblog.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * Runtime log level control for the {@code --verbose} switch.
 *
 * <p>Only the analyzer's own loggers are raised to DEBUG. Library loggers such as the
 * OpenTelemetry SDK keep the levels set in {@code logback.xml}.</p>
 *
 * @since 0.1.0
 */
public final class LoggingConfigurator {
  static final String ANALYZER_LOGGER = "ca.gc.cra.cblog";

  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Raises the {@code ca.gc.cra.cblog} logger hierarchy to DEBUG.
   *
   * @return {@code false} when the SLF4J backend is not Logback and nothing changed
   */
  public static boolean enableVerboseLogging() {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext context)) {
      log.warn("--verbose ignored: logging backend {} cannot change levels at runtime",
          factory.getClass().getName());
      return false;
    }
    Logger analyzer = context.getLogger(ANALYZER_LOGGER);
    analyzer.setLevel(Level.DEBUG);
    return true;
  }
}
