package ca.gc.cra.cblog.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CliInputTest {

  @Test
  void optionsKeepCommandLineOrderAndTimestampColons() {
    CliInput input = CliInput.parse(new String[] {
        "in=debug.log", " format = ndjson ", "to=2024-05-01T10:00:00Z"});

    Map<String, String> options = input.options();

    assertEquals(List.of("in", "format", "to"), List.copyOf(options.keySet()));
    assertEquals("ndjson", options.get("format"));
    assertEquals("2024-05-01T10:00:00Z", options.get("to"));
  }

  @Test
  void switchesAreCaseInsensitiveAndAliased() {
    CliInput input = CliInput.parse(new String[] {"in=a.log", "--DRY-RUN", "-v", "--allow-overwrite"});

    assertEquals(List.of("in=a.log"), input.assignments());
    assertTrue(input.has(CliInput.Switch.DRY_RUN));
    assertTrue(input.has(CliInput.Switch.ALLOW_OVERWRITE));
    assertTrue(input.verbose());
    assertFalse(input.help());
    assertTrue(input.unrecognized().isEmpty());
  }

  @Test
  void unknownSwitchesAreCollected() {
    CliInput input = CliInput.parse(new String[] {"--plot", "-X", "in=a.log"});

    assertEquals(List.of("--plot", "-x"), input.unrecognized());
    assertEquals(1, input.options().size());
  }

  @Test
  void malformedOptionsFailOnlyWhenRequested() {
    CliInput missingValue = CliInput.parse(new String[] {"in="});
    CliInput bareWord = CliInput.parse(new String[] {"debug.log"});
    CliInput badName = CliInput.parse(new String[] {"in file=x"});

    assertThrows(IllegalArgumentException.class, missingValue::options);
    assertThrows(IllegalArgumentException.class, bareWord::options);
    assertThrows(IllegalArgumentException.class, badName::options);
  }

  @Test
  void repeatedOptionIsRejected() {
    CliInput input = CliInput.parse(new String[] {"in=a.log", "in=b.log"});

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, input::options);
    assertTrue(ex.getMessage().contains("in given more than once"));
  }

  @Test
  void nullArgumentsYieldNothing() {
    CliInput input = CliInput.parse(null);

    assertTrue(input.options().isEmpty());
    assertTrue(input.switches().isEmpty());
  }
}
