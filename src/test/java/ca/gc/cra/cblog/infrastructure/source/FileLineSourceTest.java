package ca.gc.cra.cblog.infrastructure.source;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileLineSourceTest {
  @TempDir Path dir;

  @Test
  void readsLinesWithoutTerminators() throws IOException {
    Path file = dir.resolve("debug.log");
    Files.writeString(file, "T1 [net] one\r\nT2 [net] two\n\nT3 last");

    List<String> lines = new ArrayList<>();
    try (FileLineSource source = FileLineSource.open(file)) {
      Optional<String> next;
      while ((next = source.nextLine()).isPresent()) {
        lines.add(next.get());
      }
      assertEquals(file, source.path());
    }

    assertEquals(List.of("T1 [net] one", "T2 [net] two", "", "T3 last"), lines);
  }

  @Test
  void surroundingWhitespaceIsStripped() throws IOException {
    Path file = dir.resolve("debug.log");
    Files.writeString(file, "  T1 [net] one \t\n   \n\tT2 [net]     - Max send per-rtt: 1500 bytes  \n");

    try (FileLineSource source = FileLineSource.open(file)) {
      assertEquals(Optional.of("T1 [net] one"), source.nextLine());
      assertEquals(Optional.of(""), source.nextLine());
      assertEquals(Optional.of("T2 [net]     - Max send per-rtt: 1500 bytes"), source.nextLine());
      assertEquals(Optional.empty(), source.nextLine());
    }
  }

  @Test
  void invalidUtf8IsReplaced() throws IOException {
    Path file = dir.resolve("debug.log");
    Files.write(file, new byte[] {'T', '1', ' ', (byte) 0xC3, (byte) 0x28, '\n'});

    try (FileLineSource source = FileLineSource.open(file)) {
      String line = source.nextLine().orElseThrow();
      assertTrue(line.startsWith("T1 "));
      assertTrue(line.contains("\uFFFD"));
    }
  }

  @Test
  void missingFileFailsToOpen() {
    assertThrows(IOException.class, () -> FileLineSource.open(dir.resolve("absent.log")));
  }

  @Test
  void inMemorySourceSplitsText() {
    InMemoryLineSource source = InMemoryLineSource.of("a\n b \r\nc");

    assertEquals(Optional.of("a"), source.nextLine());
    assertEquals(Optional.of("b"), source.nextLine());
    assertEquals(Optional.of("c"), source.nextLine());
    assertEquals(Optional.empty(), source.nextLine());
  }
}
