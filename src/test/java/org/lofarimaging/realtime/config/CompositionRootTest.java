package org.lofarimaging.realtime.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.lofarimaging.realtime.application.pipeline.ObservationService;
import org.lofarimaging.realtime.application.port.ClockPort;
import org.lofarimaging.realtime.application.state.ObservationState;
import org.lofarimaging.realtime.domain.block.BlockSidecar;
import org.lofarimaging.realtime.domain.block.XstBlock;
import org.lofarimaging.realtime.domain.status.SystemStatus;
import org.lofarimaging.realtime.infrastructure.metrics.NoOpMetricsAdapter;
import org.lofarimaging.realtime.infrastructure.render.DisabledRenderer;
import org.lofarimaging.realtime.infrastructure.render.ExternalProcessRenderer;

class CompositionRootTest {
  private static final long START_MILLIS = 1_709_288_100_000L;

  @TempDir Path tempDir;

  @Test
  void observesRecordedStreamEndToEnd() throws Exception {
    Path input = Files.createDirectories(tempDir.resolve("xst"));
    Path images = tempDir.resolve("images");
    int blockSize = XstBlock.sizeInBytes(96);
    byte[] stream = new byte[blockSize * 3];
    for (int i = 0; i < stream.length; i++) {
      stream[i] = (byte) (i / blockSize + 1);
    }
    Files.write(input.resolve("20240301_101500_xst.dat"), stream);

    ObservationConfig config = ObservationConfig.fromMap(Map.of(
        "input", input.toString(),
        "out", images.toString(),
        "station", "CS002",
        "manualSubbands", "true",
        "minSubband", "100",
        "maxSubband", "102",
        "graceDelayMillis", "0",
        "pollMillis", "10",
        "threads", "2"));
    AtomicInteger ticks = new AtomicInteger();
    ClockPort clock = () -> START_MILLIS + ticks.getAndIncrement() * 1_000L;
    CompositionRoot root = new CompositionRoot(config, new NoOpMetricsAdapter(), clock);
    ObservationState state = root.observationState();
    ObservationService service = root.observationService();

    assertTrue(service.start(config.toSettings()));
    awaitBlocks(state, 3L);
    assertTrue(service.stop());
    assertTrue(service.awaitCompletion(Duration.ofSeconds(10)));

    assertTrue(service.lastFailure().isEmpty());
    assertEquals(SystemStatus.IDLE, state.status());
    assertEquals(0, state.pendingCount());
    assertEquals(3L, service.lastSummary().orElseThrow().offered());

    Path observation = images.resolve("20240301_101500");
    Path blocks = observation.resolve("blocks");
    List<Path> data = list(blocks, "_xst.dat");
    List<Path> sidecars = list(blocks, "_xst.h");
    assertEquals(3, data.size());
    assertEquals(3, sidecars.size());
    List<Integer> subbands = sidecars.stream()
        .map(CompositionRootTest::subband)
        .collect(Collectors.toList());
    assertEquals(List.of(100, 101, 102), subbands);
    assertEquals(blockSize, Files.size(data.get(0)));
    assertEquals(3, Files.readAllBytes(data.get(2))[0]);
    assertTrue(Files.isRegularFile(observation.resolve("session_log.json")));
  }

  @Test
  void rendererFollowsConfiguredMode() {
    ObservationConfig none = ObservationConfig.fromMap(Map.of());
    ObservationConfig process =
        ObservationConfig.fromMap(Map.of("renderer", "process", "rendererCommand", "/bin/true"));

    assertInstanceOf(DisabledRenderer.class, root(none).renderer());
    assertInstanceOf(ExternalProcessRenderer.class, root(process).renderer());
  }

  @Test
  void warmupOnlyWhenConfigured() {
    assertTrue(root(ObservationConfig.fromMap(Map.of())).rendererWarmup().isEmpty());
    ObservationConfig withWarmup =
        ObservationConfig.fromMap(Map.of("warmupFile", tempDir.resolve("warmup_xst.dat").toString()));
    assertTrue(root(withWarmup).rendererWarmup().isPresent());
  }

  @Test
  void noneExporterSelectsNoOpMetrics() {
    assertInstanceOf(NoOpMetricsAdapter.class, CompositionRoot.metricsFor(" None ", "CS002"));
  }

  private static CompositionRoot root(ObservationConfig config) {
    return new CompositionRoot(config, new NoOpMetricsAdapter(), ClockPort.SYSTEM);
  }

  private static void awaitBlocks(ObservationState state, long blockCount) throws InterruptedException {
    long deadline = System.nanoTime() + Duration.ofSeconds(10).toNanos();
    while (System.nanoTime() < deadline) {
      ObservationState.View view = state.view();
      if (view.lastBlockNumber() != null && view.lastBlockNumber() >= blockCount && view.pendingCount() == 0) {
        return;
      }
      Thread.sleep(10);
    }
  }

  private static List<Path> list(Path directory, String suffix) throws Exception {
    try (Stream<Path> files = Files.list(directory)) {
      return files
          .filter(path -> path.getFileName().toString().endsWith(suffix))
          .sorted()
          .collect(Collectors.toList());
    }
  }

  private static int subband(Path sidecar) {
    try {
      return BlockSidecar.parseSubband(Files.readString(sidecar, StandardCharsets.UTF_8)).orElseThrow();
    } catch (IOException ex) {
      throw new IllegalStateException(ex);
    }
  }
}
