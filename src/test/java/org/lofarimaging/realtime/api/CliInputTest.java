package org.lofarimaging.realtime.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class CliInputTest {

  @Test
  void separatesFlagsFromKeyValues() {
    CliInput input = CliInput.parse(new String[] {"observe", "--DRY-RUN", "-v", "station=CS002", " "});

    assertArrayEquals(new String[] {"observe", "station=CS002"}, input.keyValueArgs());
    assertTrue(input.verbose());
    assertFalse(input.help());
    assertTrue(input.hasFlag("--dry-run"));
    assertTrue(input.hasFlag("--verbose"));
    assertFalse(input.hasFlag(""));
  }

  @Test
  void helpAliasesAreRecognised() {
    assertTrue(CliInput.parse(new String[] {"help"}).help());
    assertTrue(CliInput.parse(new String[] {"-h"}).help());
    assertTrue(CliInput.parse(new String[] {"--help"}).hasFlag("--help"));
  }

  @Test
  void dashedKeyValueIsNotAFlag() {
    CliInput input = CliInput.parse(new String[] {"--config=lofar.yaml"});
    assertArrayEquals(new String[] {"--config=lofar.yaml"}, input.keyValueArgs());
  }

  @Test
  void nullArgsParseToEmpty() {
    CliInput input = CliInput.parse(null);
    assertArrayEquals(new String[0], input.keyValueArgs());
    assertFalse(input.verbose());
  }

  @Test
  void subcommandReceivesRemainingWordsAndCanonicalSwitches() {
    CliInput input = CliInput.parse(new String[] {"Observe", "-n", "threads=2", "--debug"});

    assertEquals("observe", input.command().orElseThrow());
    assertArrayEquals(new String[] {"threads=2", "--dry-run", "--verbose"}, input.subcommandArgs());
    assertTrue(input.dryRun());
    assertTrue(input.hasFlag("-v"));
  }

  @Test
  void noWordsMeansNoCommand() {
    CliInput input = CliInput.parse(new String[] {"--help"});
    assertTrue(input.command().isEmpty());
    assertArrayEquals(new String[] {"--help"}, input.subcommandArgs());
  }
}
