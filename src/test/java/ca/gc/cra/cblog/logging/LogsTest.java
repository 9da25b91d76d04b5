package ca.gc.cra.cblog.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class LogsTest {

  @Test
  void shortLinesAreQuotedWhole() {
    assertEquals("T1 [net] body", Logs.excerpt("T1 [net] body", 64));
  }

  @Test
  void longLinesReportDroppedCodePoints() {
    assertEquals("abcd [+6 more]", Logs.excerpt("abcdefghij", 4));
  }

  @Test
  void surrogatePairsCountAsOneCodePoint() {
    assertEquals("a😀 [+1 more]", Logs.excerpt("a😀b", 2));
  }

  @Test
  void controlCharactersAreEscaped() {
    assertEquals("a\\tb\\rc\\u0007", Logs.excerpt("a\tb\rc\u0007", 64));
  }

  @Test
  void nullLineAndInvalidLimit() {
    assertEquals("<no line>", Logs.excerpt(null, 4));
    assertThrows(IllegalArgumentException.class, () -> Logs.excerpt("x", 0));
  }
}
