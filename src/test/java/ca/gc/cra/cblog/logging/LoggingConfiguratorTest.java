package ca.gc.cra.cblog.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingConfiguratorTest {
  private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
  private final Level rootBefore = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME).getLevel();

  @AfterEach
  void restore() {
    context.getLogger(LoggingConfigurator.ANALYZER_LOGGER).setLevel(null);
  }

  @Test
  void verboseRaisesOnlyAnalyzerLoggers() {
    assertTrue(LoggingConfigurator.enableVerboseLogging());

    Logger correlate = context.getLogger("ca.gc.cra.cblog.application.correlate.CompactBlockCorrelationEngine");
    assertEquals(Level.DEBUG, correlate.getEffectiveLevel());
    assertEquals(rootBefore, context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME).getLevel());
  }
}
