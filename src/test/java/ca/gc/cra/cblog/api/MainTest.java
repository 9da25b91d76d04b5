package ca.gc.cra.cblog.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MainTest {
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void missingCommandPrintsUsage() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[0]));
    assertTrue(buffer.toString().contains("usage: cblog"));
  }

  @Test
  void unknownCommandIsRejected() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"plot"}));
  }

  @Test
  void helpListsCommands() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help"}));
    String text = buffer.toString();
    assertTrue(text.contains("parse"));
    assertTrue(text.contains("stats"));
    assertTrue(text.contains("filter"));
    assertTrue(text.contains("Exit codes:"));
    assertTrue(text.contains("  7   a send named a different peer"));
  }

  @Test
  void helpListsOnlyStatusesTheCommandsReturn() {
    assertEquals(ExitCode.values().length, ExitCode.helpLines().size());
    assertEquals("  6   a line broke the annotation grammar or carried an out-of-range field",
        ExitCode.helpLines().get(5));
    assertTrue(ExitCode.helpLines().stream().noneMatch(line -> line.startsWith("  130")));
  }

  @Test
  void statsCommandPrintsReport() throws Exception {
    Path fixture = Path.of(getClass().getResource("/fixtures/compactblocks.log").toURI());

    ExitCode code = Main.run(new String[] {"STATS", "in=" + fixture});

    assertEquals(ExitCode.SUCCESS, code);
    String text = buffer.toString();
    assertTrue(text.contains("Received compact blocks"));
    assertTrue(text.contains("1 out of 3 blocks received failed reconstruction."));
    assertTrue(text.contains("Send window"));
  }

  @Test
  void statsWithMissingInputIsRejected() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"stats", "in=/does/not/exist.log"}));
    assertTrue(buffer.toString().contains("usage: stats"));
  }
}
