package ca.gc.cra.cblog.domain.line;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class TimeWindowTest {

  @Test
  void boundsAreInclusive() {
    TimeWindow window = TimeWindow.of("2024-05-01T10:00", "2024-05-01T11:00");

    assertTrue(window.contains("2024-05-01T10:00"));
    assertTrue(window.contains("2024-05-01T10:30:00.000000Z"));
    assertTrue(window.contains("2024-05-01T11:00"));
    assertFalse(window.contains("2024-05-01T09:59:59.999999Z"));
    assertFalse(window.contains("2024-05-01T11:00:00.000001Z"));
  }

  @Test
  void blankBoundsAreOpen() {
    TimeWindow window = TimeWindow.of(" ", null);

    assertTrue(window.isUnbounded());
    assertTrue(window.contains("anything"));
  }

  @Test
  void halfOpenWindowChecksOneSide() {
    TimeWindow window = TimeWindow.of("2024-05-01", null);

    assertTrue(window.contains("2030-01-01"));
    assertFalse(window.contains("2024-04-30"));
  }

  @Test
  void invertedWindowIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> TimeWindow.of("2024-05-02", "2024-05-01"));
  }
}
