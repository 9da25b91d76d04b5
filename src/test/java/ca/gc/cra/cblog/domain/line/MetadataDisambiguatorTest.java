package ca.gc.cra.cblog.domain.line;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import org.junit.jupiter.api.Test;

class MetadataDisambiguatorTest {
  private final MetadataDisambiguator disambiguator = new MetadataDisambiguator();

  @Test
  void noAnnotationsLeavesEveryOptionalFieldAbsent() {
    LogMetadata metadata = disambiguate("T1", List.of());

    assertEquals("T1", metadata.timestamp());
    assertFalse(metadata.hasAnnotations());
    assertNull(metadata.category());
    assertNull(metadata.logLevel());
    assertNull(metadata.sourceLine());
  }

  @Test
  void resolvesEverySlot() {
    LogMetadata metadata = disambiguate(
        "T1", List.of("msghand", "validation.cpp:1234", "ConnectTip", "validation:info", "default wallet"));

    assertEquals("msghand", metadata.thread());
    assertEquals("validation.cpp", metadata.sourceFile());
    assertEquals(1234, metadata.sourceLine());
    assertEquals("ConnectTip", metadata.function());
    assertEquals("validation", metadata.category());
    assertEquals("info", metadata.logLevel());
    assertEquals("default wallet", metadata.walletName());
  }

  @Test
  void categoryNameDoublingAsThreadNameIsCategoryWhenRightmost() {
    LogMetadata metadata = disambiguate("T1", List.of("net", "net"));

    assertEquals("net", metadata.thread());
    assertEquals("net", metadata.category());
    assertNull(metadata.walletName());
  }

  @Test
  void numberedWorkerThreadsAreThreads() {
    LogMetadata metadata = disambiguate("T1", List.of("httpworker.3", "http"));

    assertEquals("httpworker.3", metadata.thread());
    assertEquals("http", metadata.category());
  }

  @Test
  void operatorOverloadsAreFunctions() {
    LogMetadata metadata = disambiguate("T1", List.of("operator()", "net"));

    assertEquals("operator()", metadata.function());
  }

  @Test
  void headerFilesAreSourceLocations() {
    LogMetadata metadata = disambiguate("T1", List.of("sync.h:88", "lock"));

    assertEquals("sync.h", metadata.sourceFile());
    assertEquals(88, metadata.sourceLine());
  }

  @Test
  void walletWithoutCategoryIsRejected() {
    MissingCategoryException ex = assertThrows(
        MissingCategoryException.class, () -> disambiguate("T1", List.of("msghand", "my wallet")));

    assertEquals("msghand", ex.token());
  }

  @Test
  void loneWalletIsRejected() {
    MissingCategoryException ex = assertThrows(
        MissingCategoryException.class, () -> disambiguate("T1", List.of("my wallet")));

    assertNull(ex.token());
    assertTrue(ex.getMessage().contains("my wallet"));
  }

  @Test
  void unknownShapeIsRejected() {
    UnrecognizedAnnotationException ex = assertThrows(
        UnrecognizedAnnotationException.class, () -> disambiguate("T1", List.of("peer 3", "net")));

    assertEquals("peer 3", ex.token());
    assertTrue(ex.line().startsWith("T1"));
  }

  @Test
  void secondAnnotationForTheSameSlotIsRejected() {
    assertThrows(
        UnrecognizedAnnotationException.class,
        () -> disambiguate("T1", List.of("ConnectTip", "ActivateBestChain", "validation")));
  }

  @Test
  void oversizedSourceLineIsRejected() {
    assertThrows(
        UnrecognizedAnnotationException.class,
        () -> disambiguate("T1", List.of("net.cpp:99999999999", "net")));
  }

  @Test
  void customVocabularyIsHonoured() {
    MetadataDisambiguator custom = new MetadataDisambiguator(
        new AnnotationTables(Set.of("relay"), Set.of("relayer"), List.of(Pattern.compile("^w\\d+$"))));

    LogMetadata metadata = custom.disambiguate(tokens("T1", List.of("w7", "relay:debug")));

    assertEquals("w7", metadata.thread());
    assertEquals("relay", metadata.category());
    assertEquals("debug", metadata.logLevel());
  }

  private LogMetadata disambiguate(String timestamp, List<String> annotations) {
    return disambiguator.disambiguate(tokens(timestamp, annotations));
  }

  private static TokenizedLine tokens(String timestamp, List<String> annotations) {
    StringBuilder line = new StringBuilder(timestamp).append(' ');
    StringBuilder prefix = new StringBuilder();
    for (String annotation : annotations) {
      prefix.append('[').append(annotation).append("] ");
    }
    line.append(prefix).append("body");
    return new TokenizedLine(timestamp, prefix.toString(), annotations, "body", line.toString());
  }
}
