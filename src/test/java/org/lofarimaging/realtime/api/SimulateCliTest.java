package org.lofarimaging.realtime.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.lofarimaging.realtime.domain.block.XstBlock;

class SimulateCliTest {
  @TempDir Path tempDir;

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
  void replaysRecordingIntoStream() throws Exception {
    int blockSize = XstBlock.sizeInBytes(96);
    Path source = tempDir.resolve("recording.dat");
    Files.write(source, new byte[blockSize * 2 + 10]);
    Path target = tempDir.resolve("live").resolve("stream_xst.dat");

    ExitCode code = SimulateCli.run(new String[] {
        "source=" + source,
        "target=" + target,
        "station=CS002",
        "minSubband=200",
        "maxSubband=203",
        "intervalMillis=0"});

    assertEquals(ExitCode.SUCCESS, code);
    assertEquals(blockSize * 2L, Files.size(target));
    assertEquals(
        "subbands=200:203\n",
        Files.readString(target.resolveSibling("metadata.h"), StandardCharsets.UTF_8));
    assertTrue(buffer.toString().contains("Wrote 2 block(s)"));
  }

  @Test
  void missingSourceIsRejected() {
    ExitCode code = SimulateCli.run(new String[] {
        "source=" + tempDir.resolve("absent.dat"),
        "target=" + tempDir.resolve("stream_xst.dat")});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: simulate"));
  }

  @Test
  void targetWithoutXstSuffixIsRejected() throws Exception {
    Path source = Files.write(tempDir.resolve("recording.dat"), new byte[16]);

    ExitCode code = SimulateCli.run(new String[] {
        "source=" + source,
        "target=" + tempDir.resolve("stream.dat")});

    assertEquals(ExitCode.INVALID_ARGS, code);
  }
}
