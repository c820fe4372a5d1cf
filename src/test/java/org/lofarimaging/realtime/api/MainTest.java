package org.lofarimaging.realtime.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MainTest {
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer, true));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void missingCommandPrintsUsage() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[0]));
    assertTrue(buffer.toString().contains("usage: lofar-realtime"));
  }

  @Test
  void helpListsCommands() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help"}));
    String output = buffer.toString();
    assertTrue(output.contains("observe"));
    assertTrue(output.contains("simulate"));
  }

  @Test
  void unknownCommandIsRejected() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"capture"}));
    assertTrue(buffer.toString().contains("usage: lofar-realtime"));
  }

  @Test
  void helpFlagIsForwardedToCommand() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"analyze", "--help"}));
    assertTrue(buffer.toString().contains("Summarise archived XST blocks"));
  }
}
