package org.lofarimaging.realtime.infrastructure.render;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.lofarimaging.realtime.application.port.RenderRequest;
import org.lofarimaging.realtime.application.port.RenderResult;
import org.lofarimaging.realtime.domain.block.XstBlock;
import org.lofarimaging.realtime.domain.station.StationGeometry;

class ExternalProcessRendererTest {
  private static final StationGeometry STATION = StationGeometry.of("LV614", 3, 1.5, 50);
  private static final Path SH = Path.of("/bin/sh");

  @Test
  void buildsImagerArguments() {
    ExternalProcessRenderer renderer =
        new ExternalProcessRenderer(List.of("python3", "render.py"), Duration.ofMinutes(1), null);
    XstBlock block = new XstBlock(3, Instant.parse("2024-03-01T10:15:00Z"), 101, 1, new byte[16]);
    RenderRequest request =
        new RenderRequest(block, STATION, Path.of("/out/images"), Path.of("/opt/caltables"));

    List<String> args = renderer.arguments(request, Path.of("/tmp/block.dat"));

    assertEquals(List.of(
        "python3", "render.py",
        "--dat", "/tmp/block.dat",
        "--station", "LV614",
        "--rcu-mode", "3",
        "--subband", "101",
        "--timestamp", "2024-03-01T10:15:00Z",
        "--height", "1.5",
        "--extent", "50.0",
        "--pixels-per-metre", "1.5",
        "--caltable-dir", "/opt/caltables",
        "--output", "/out/images"), args);
  }

  @Test
  void omitsCaltableDirWhenUnset() {
    ExternalProcessRenderer renderer = new ExternalProcessRenderer(List.of("imager"), Duration.ofMinutes(1), null);
    XstBlock block = new XstBlock(0, Instant.EPOCH, 100, 1, new byte[16]);
    List<String> args = renderer.arguments(new RenderRequest(block, STATION, Path.of("/out"), null), Path.of("b.dat"));
    assertFalse(args.contains("--caltable-dir"));
  }

  @Test
  void parsesStdoutOfSuccessfulCommand(@TempDir Path dir) throws Exception {
    assumeTrue(Files.isExecutable(SH));
    ExternalProcessRenderer renderer = new ExternalProcessRenderer(
        List.of(SH.toString(), "-c", "echo nearfield=nf.png", "imager"), Duration.ofSeconds(30), dir);
    XstBlock block = new XstBlock(0, Instant.EPOCH, 100, 1, new byte[16]);

    RenderResult result = renderer.render(new RenderRequest(block, STATION, dir.resolve("images"), null));

    assertEquals(dir.resolve("images").resolve("nf.png"), result.nearFieldImage().orElseThrow());
    try (var leftovers = Files.list(dir)) {
      assertEquals(0, leftovers.count());
    }
  }

  @Test
  void nonZeroExitFailsWithStderrExcerpt(@TempDir Path dir) throws Exception {
    assumeTrue(Files.isExecutable(SH));
    ExternalProcessRenderer renderer = new ExternalProcessRenderer(
        List.of(SH.toString(), "-c", "echo bad calibration >&2; exit 3", "imager"), Duration.ofSeconds(30), dir);
    XstBlock block = new XstBlock(0, Instant.EPOCH, 100, 1, new byte[16]);

    IOException failure = assertThrows(IOException.class,
        () -> renderer.render(new RenderRequest(block, STATION, dir.resolve("images"), null)));

    assertTrue(failure.getMessage().contains("status 3"));
    assertTrue(failure.getMessage().contains("bad calibration"));
  }

  @Test
  void rejectsEmptyCommandAndNonPositiveTimeout() {
    assertThrows(IllegalArgumentException.class,
        () -> new ExternalProcessRenderer(List.of(), Duration.ofSeconds(1), null));
    assertThrows(IllegalArgumentException.class,
        () -> new ExternalProcessRenderer(List.of("imager"), Duration.ZERO, null));
  }
}
