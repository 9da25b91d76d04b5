package ca.gc.cra.cblog.domain.line;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class LineTokenizerTest {

  @Test
  void splitsTimestampAnnotationsAndBody() throws MalformedLineException {
    TokenizedLine tokens = LineTokenizer.tokenize(
        "2024-05-01T10:00:00Z [msghand] [net] sending cmpctblock (120 bytes) peer=7");

    assertEquals("2024-05-01T10:00:00Z", tokens.timestamp());
    assertEquals(List.of("msghand", "net"), tokens.annotations());
    assertEquals("sending cmpctblock (120 bytes) peer=7", tokens.body());
  }

  @Test
  void lineWithoutAnnotationsKeepsWholeRemainderAsBody() throws MalformedLineException {
    TokenizedLine tokens = LineTokenizer.tokenize("T1 Bitcoin Core version v27.0.0");

    assertEquals("T1", tokens.timestamp());
    assertTrue(tokens.annotations().isEmpty());
    assertEquals("Bitcoin Core version v27.0.0", tokens.body());
  }

  @Test
  void leadingWhitespaceOfBodyIsDropped() throws MalformedLineException {
    TokenizedLine tokens = LineTokenizer.tokenize("T4 [net]     - Max send per-rtt: 1500 bytes");

    assertEquals("- Max send per-rtt: 1500 bytes", tokens.body());
  }

  @Test
  void surroundingWhitespaceIsStripped() throws MalformedLineException {
    TokenizedLine tokens = LineTokenizer.tokenize("  T1 [net] body  \r");

    assertEquals("T1", tokens.timestamp());
    assertEquals("body", tokens.body());
  }

  @Test
  void bodyStartingWithBracketsIsConsumedAsAnnotation() throws MalformedLineException {
    TokenizedLine tokens = LineTokenizer.tokenize("T1 [net] [peer 3] disconnected");

    assertEquals(List.of("net", "peer 3"), tokens.annotations());
    assertEquals("disconnected", tokens.body());
  }

  @Test
  void unterminatedBracketStartsTheBody() throws MalformedLineException {
    TokenizedLine tokens = LineTokenizer.tokenize("T1 [net] [unterminated body");

    assertEquals(List.of("net"), tokens.annotations());
    assertEquals("[unterminated body", tokens.body());
  }

  @Test
  void lineWithoutSeparatorIsMalformed() {
    MalformedLineException ex = assertThrows(
        MalformedLineException.class, () -> LineTokenizer.tokenize("garbage-without-separator"));

    assertEquals("garbage-without-separator", ex.line());
  }

  @Test
  void blankLineIsMalformed() {
    assertThrows(MalformedLineException.class, () -> LineTokenizer.tokenize("   "));
  }
}
