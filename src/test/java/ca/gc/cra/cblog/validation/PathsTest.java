package ca.gc.cra.cblog.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PathsTest {

  @TempDir Path tempDir;

  @Test
  void readableFileIsResolvedToRealPath() throws IOException {
    Path log = Files.writeString(tempDir.resolve("debug.log"), "T1 body\n");

    assertEquals(log.toRealPath(), Paths.requireReadableFile(log));
  }

  @Test
  void directoryIsNotAReadableFile() {
    assertThrows(IllegalArgumentException.class, () -> Paths.requireReadableFile(tempDir));
    assertThrows(IllegalArgumentException.class, () -> Paths.requireReadableFile(tempDir.resolve("absent.log")));
  }

  @Test
  void nonEmptyExportDirectoryNeedsReuse() throws IOException {
    Path dir = Files.createDirectory(tempDir.resolve("out"));
    Files.createFile(dir.resolve("received.csv"));

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Paths.prepareExportDirectory(dir, false, false));
    assertTrue(ex.getMessage().contains("--allow-overwrite"));
    assertEquals(dir.toRealPath(), Paths.prepareExportDirectory(dir, false, true));
  }

  @Test
  void missingDirectoryIsCreatedOnlyWhenRequested() {
    Path dir = tempDir.resolve("reports/today");

    Paths.prepareExportDirectory(dir, false, false);
    assertFalse(Files.exists(dir));

    Path created = Paths.prepareExportDirectory(dir, true, false);
    assertTrue(Files.isDirectory(created));
  }

  @Test
  void regularFileIsNotAnExportDirectory() throws IOException {
    Path file = Files.writeString(tempDir.resolve("received.csv"), "block_hash\n");

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Paths.prepareExportDirectory(file, true, true));
    assertTrue(ex.getMessage().contains("not a directory"));
  }
}
