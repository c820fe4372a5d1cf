package org.lofarimaging.realtime.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.lofarimaging.realtime.domain.block.BlockSidecar;
import org.lofarimaging.realtime.domain.block.SubbandRange;

class AnalyzeCliTest {
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
  void printsArchiveSummary() throws Exception {
    SubbandRange range = new SubbandRange(100, 101);
    Files.write(tempDir.resolve("20240301_101500_xst.dat"), new byte[16]);
    Files.writeString(tempDir.resolve("20240301_101500_xst.h"), BlockSidecar.render(range, 100));
    Files.write(tempDir.resolve("20240301_101502_xst.dat"), new byte[16]);
    Files.writeString(tempDir.resolve("20240301_101502_xst.h"), BlockSidecar.render(range, 101));

    ExitCode code = AnalyzeCli.run(new String[] {"in=" + tempDir});

    assertEquals(ExitCode.SUCCESS, code);
    String output = buffer.toString();
    assertTrue(output.contains("Number of files: 2"));
    assertTrue(output.contains("First and last subband: 100 - 101"));
  }

  @Test
  void missingInIsRejected() {
    assertEquals(ExitCode.INVALID_ARGS, AnalyzeCli.run(new String[0]));
    assertTrue(buffer.toString().contains("usage: analyze"));
  }

  @Test
  void inconsistentArchiveIsAnIoError() throws Exception {
    Files.write(tempDir.resolve("20240301_101500_xst.dat"), new byte[16]);

    assertEquals(ExitCode.IO_ERROR, AnalyzeCli.run(new String[] {"in=" + tempDir}));
  }
}
