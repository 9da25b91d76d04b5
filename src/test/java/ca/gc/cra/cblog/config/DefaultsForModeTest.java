package ca.gc.cra.cblog.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Map;
import org.junit.jupiter.api.Test;

class DefaultsForModeTest {

  @Test
  void parseDefaultsIncludeOutputSettings() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("parse");

    assertEquals("cblog-out", defaults.get("out"));
    assertEquals("csv", defaults.get("format"));
    assertEquals("false", defaults.get("allowOverwrite"));
    assertEquals("none", defaults.get("metricsExporter"));
  }

  @Test
  void readOnlyModesShareCommonDefaults() {
    Map<String, String> stats = DefaultsForMode.asFlatMap("Stats");

    assertEquals("false", stats.get("verbose"));
    assertFalse(stats.containsKey("out"));
    assertEquals(stats, DefaultsForMode.asFlatMap("filter"));
  }

  @Test
  void unknownModeIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> DefaultsForMode.asFlatMap("capture"));
  }
}
