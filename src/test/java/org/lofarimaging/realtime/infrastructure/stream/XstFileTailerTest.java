package org.lofarimaging.realtime.infrastructure.stream;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.lofarimaging.realtime.testing.RecordingMetricsPort;

class XstFileTailerTest {
  private static final int BLOCK = 64;

  @Test
  void emitsWholeBlocksOnlyAcrossPartialWrites(@TempDir Path dir) throws Exception {
    Path file = dir.resolve("stream_xst.dat");
    Files.write(file, new byte[0]);
    byte[] payload = pattern(BLOCK * 2 + 10);
    RecordingMetricsPort metrics = new RecordingMetricsPort();

    try (XstFileTailer tailer = new XstFileTailer(file, BLOCK, Duration.ofMillis(1), metrics)) {
      tailer.start();
      append(file, Arrays.copyOfRange(payload, 0, 40));
      assertTrue(drain(tailer, 3).isEmpty());
      assertEquals(40, tailer.bufferedBytes());

      append(file, Arrays.copyOfRange(payload, 40, BLOCK * 2 + 10));
      List<byte[]> blocks = drain(tailer, 5);

      assertEquals(2, blocks.size());
      assertArrayEquals(Arrays.copyOfRange(payload, 0, BLOCK), blocks.get(0));
      assertArrayEquals(Arrays.copyOfRange(payload, BLOCK, BLOCK * 2), blocks.get(1));
      assertEquals(10, tailer.bufferedBytes());
      assertEquals(2, tailer.blocksEmitted());
    }
    assertEquals((long) BLOCK * 2 + 10, metrics.observedTotal("observe.stream.bytes"));
    assertEquals(10, metrics.observedTotal("observe.stream.discarded.bytes"));
  }

  @Test
  void pollBufferedHandsOutOnlyBlocksAlreadyRead(@TempDir Path dir) throws Exception {
    Path file = dir.resolve("stream_xst.dat");
    byte[] payload = pattern(BLOCK * 3 + 5);
    Files.write(file, payload);

    try (XstFileTailer tailer = new XstFileTailer(file, BLOCK, Duration.ofMillis(1), new RecordingMetricsPort())) {
      tailer.start();
      assertTrue(tailer.pollBuffered().isEmpty());

      assertArrayEquals(Arrays.copyOfRange(payload, 0, BLOCK), tailer.poll().orElseThrow());
      assertArrayEquals(Arrays.copyOfRange(payload, BLOCK, BLOCK * 2), tailer.pollBuffered().orElseThrow());
      assertArrayEquals(Arrays.copyOfRange(payload, BLOCK * 2, BLOCK * 3), tailer.pollBuffered().orElseThrow());
      assertTrue(tailer.pollBuffered().isEmpty());
      assertEquals(5, tailer.bufferedBytes());
      assertEquals(3, tailer.blocksEmitted());
    }
  }

  @Test
  void closeReportsUnpolledBlocksApartFromPartialRemainder(@TempDir Path dir) throws Exception {
    Path file = dir.resolve("stream_xst.dat");
    Files.write(file, pattern(BLOCK * 3 + 5));
    RecordingMetricsPort metrics = new RecordingMetricsPort();

    XstFileTailer tailer = new XstFileTailer(file, BLOCK, Duration.ofMillis(1), metrics);
    tailer.start();
    assertTrue(tailer.poll().isPresent());
    tailer.close();

    assertEquals(List.of(2L), metrics.observed("observe.stream.discarded.blocks"));
    assertEquals(List.of(5L), metrics.observed("observe.stream.discarded.bytes"));
    assertEquals(0, tailer.bufferedBytes());
  }

  @Test
  void largeAppendYieldsEveryBlockInOrder(@TempDir Path dir) throws Exception {
    Path file = dir.resolve("stream_xst.dat");
    byte[] payload = pattern(BLOCK * 12);
    Files.write(file, payload);

    try (XstFileTailer tailer = new XstFileTailer(file, BLOCK, Duration.ofMillis(1), new RecordingMetricsPort())) {
      tailer.start();
      List<byte[]> blocks = drain(tailer, 30);

      assertEquals(12, blocks.size());
      for (int i = 0; i < blocks.size(); i++) {
        assertArrayEquals(Arrays.copyOfRange(payload, i * BLOCK, (i + 1) * BLOCK), blocks.get(i), "block " + i);
      }
    }
  }

  @Test
  void pollBeforeStartFails(@TempDir Path dir) throws Exception {
    XstFileTailer tailer =
        new XstFileTailer(dir.resolve("x_xst.dat"), BLOCK, Duration.ofMillis(1), new RecordingMetricsPort());
    assertThrows(IllegalStateException.class, tailer::poll);
  }

  @Test
  void rejectsNonPositiveBlockSize(@TempDir Path dir) {
    assertThrows(IllegalArgumentException.class,
        () -> new XstFileTailer(dir.resolve("x_xst.dat"), 0, Duration.ofMillis(1), new RecordingMetricsPort()));
  }

  private static List<byte[]> drain(XstFileTailer tailer, int polls) throws Exception {
    List<byte[]> blocks = new ArrayList<>();
    for (int i = 0; i < polls; i++) {
      Optional<byte[]> block = tailer.poll();
      block.ifPresent(blocks::add);
    }
    return blocks;
  }

  private static void append(Path file, byte[] bytes) throws IOException {
    Files.write(file, bytes, StandardOpenOption.APPEND);
  }

  private static byte[] pattern(int length) {
    byte[] bytes = new byte[length];
    for (int i = 0; i < length; i++) {
      bytes[i] = (byte) (i * 31);
    }
    return bytes;
  }
}
