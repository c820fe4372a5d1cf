package org.lofarimaging.realtime.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.lofarimaging.realtime.application.port.RenderRequest;
import org.lofarimaging.realtime.application.port.RenderResult;
import org.lofarimaging.realtime.application.port.RendererPort;
import org.lofarimaging.realtime.application.state.CancellationToken;
import org.lofarimaging.realtime.application.state.ObservationState;
import org.lofarimaging.realtime.application.state.RunParameters;
import org.lofarimaging.realtime.domain.block.XstBlock;
import org.lofarimaging.realtime.domain.observation.ObservationSession;
import org.lofarimaging.realtime.domain.station.StationGeometry;
import org.lofarimaging.realtime.domain.status.ImageLogEntry;
import org.lofarimaging.realtime.domain.status.TrackingSample;
import org.lofarimaging.realtime.testing.RecordingMetricsPort;

class RenderDispatcherTest {
  private static final StationGeometry STATION = StationGeometry.of("CS002", 3, 1.5, 50);
  private static final Instant START = Instant.parse("2024-03-01T10:15:00Z");

  @TempDir Path imagesRoot;

  @Test
  void rendersEveryStepBlockOnly() throws Exception {
    ObservationState state = beginState();
    CountingRenderer renderer = new CountingRenderer();
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    RenderDispatcher dispatcher = dispatcher(renderer, state, metrics, new RenderDispatcher.Settings(2, 8, 3));
    CancellationToken token = new CancellationToken();
    dispatcher.start();

    for (int i = 0; i < 10; i++) {
      dispatcher.offer(block(i, 100 + i % 3), token);
    }
    assertTrue(dispatcher.drain(Duration.ofSeconds(5)));

    DispatchSummary summary = dispatcher.summary();
    assertEquals(10, summary.offered());
    assertEquals(7, summary.decimated());
    assertEquals(3, summary.submitted());
    assertEquals(3, summary.completed());
    assertEquals(Set.of(2L, 5L, 8L), renderer.sequences);
    assertEquals(0, state.pendingCount());
    assertEquals(7, metrics.count("observe.block.decimated"));
    assertEquals(3, metrics.count("observe.render.completed"));
    assertEquals(3, metrics.observed("observe.render.latencyMillis").size());
  }

  @Test
  void stepOneSubmitsEveryBlock() throws Exception {
    ObservationState state = beginState();
    RenderDispatcher dispatcher =
        dispatcher(new CountingRenderer(), state, new RecordingMetricsPort(), new RenderDispatcher.Settings(1, 4, 1));
    dispatcher.start();
    CancellationToken token = new CancellationToken();

    assertEquals(DispatchDecision.SUBMITTED, dispatcher.offer(block(0, 100), token));
    assertEquals(DispatchDecision.SUBMITTED, dispatcher.offer(block(1, 101), token));
    assertTrue(dispatcher.drain(Duration.ofSeconds(5)));

    assertEquals(2, dispatcher.summary().completed());
    assertEquals(0, dispatcher.summary().decimated());
  }

  @Test
  void discardsBlocksOnceStopIsRequested() throws Exception {
    ObservationState state = beginState();
    CountingRenderer renderer = new CountingRenderer();
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    RenderDispatcher dispatcher = dispatcher(renderer, state, metrics, new RenderDispatcher.Settings(1, 4, 1));
    dispatcher.start();
    CancellationToken token = new CancellationToken();
    token.cancel();

    assertEquals(DispatchDecision.DISCARDED_SHUTDOWN, dispatcher.offer(block(0, 100), token));
    assertTrue(dispatcher.drain(Duration.ofSeconds(5)));

    assertEquals(0, renderer.calls.get());
    assertEquals(1, dispatcher.summary().discarded());
    assertEquals(0, state.pendingCount());
    assertEquals(1, metrics.count("observe.block.discarded.shutdown"));
  }

  @Test
  void queuedTasksSkipRenderAfterCancellation() throws Exception {
    ObservationState state = beginState();
    BlockingRenderer renderer = new BlockingRenderer();
    RenderDispatcher dispatcher =
        dispatcher(renderer, state, new RecordingMetricsPort(), new RenderDispatcher.Settings(1, 4, 1));
    dispatcher.start();
    CancellationToken token = new CancellationToken();

    dispatcher.offer(block(0, 100), token);
    assertTrue(renderer.started.await(5, TimeUnit.SECONDS));
    dispatcher.offer(block(1, 101), token);
    assertEquals(2, state.pendingCount());

    token.cancel();
    renderer.release.countDown();
    assertTrue(dispatcher.drain(Duration.ofSeconds(5)));

    DispatchSummary summary = dispatcher.summary();
    assertEquals(1, summary.completed());
    assertEquals(1, summary.cancelled());
    assertEquals(1, renderer.calls.get());
    assertEquals(0, state.pendingCount());
  }

  @Test
  void failingRenderDoesNotAffectSiblings() throws Exception {
    ObservationState state = beginState();
    RendererPort renderer = request -> {
      if (request.block().subband() == 101) {
        throw new IllegalStateException("imager crashed on 101");
      }
      return RenderResult.empty();
    };
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    RenderDispatcher dispatcher = dispatcher(renderer, state, metrics, new RenderDispatcher.Settings(3, 8, 1));
    dispatcher.start();
    CancellationToken token = new CancellationToken();

    for (int i = 0; i < 3; i++) {
      dispatcher.offer(block(i, 100 + i), token);
    }
    assertTrue(dispatcher.drain(Duration.ofSeconds(5)));

    DispatchSummary summary = dispatcher.summary();
    assertEquals(2, summary.completed());
    assertEquals(1, summary.failed());
    assertEquals("imager crashed on 101", summary.lastFailure());
    assertEquals(1, metrics.count("observe.render.failed"));
    assertEquals(0, state.pendingCount());
  }

  @Test
  void nearFieldImagesAndTrackingReachState() throws Exception {
    ObservationState state = beginState();
    ObservationSession session = ObservationSession.create(imagesRoot, START);
    RendererPort renderer = request -> new RenderResult(
        Optional.empty(),
        Optional.of(request.outputDir().resolve("nearfield_" + request.block().subband() + ".png")),
        Optional.of(new TrackingSample("2024-03-01T10:15:00", 56.9, 21.8, 1.0, 2.0, -40.0, null)));
    RenderDispatcher dispatcher = new RenderDispatcher(
        renderer, state, new RecordingMetricsPort(), new RenderDispatcher.Settings(1, 4, 1), session, STATION, null);
    dispatcher.start();

    dispatcher.offer(block(4, 101), new CancellationToken());
    assertTrue(dispatcher.drain(Duration.ofSeconds(5)));

    List<ImageLogEntry> log = state.imageLog();
    assertEquals(1, log.size());
    ImageLogEntry entry = log.get(0);
    assertEquals("20240301_101500/images/nearfield_101.png", entry.filename());
    assertEquals(101, entry.subband());
    assertEquals(ImageLogEntry.STATUS_PROCESSED, entry.status());
    assertEquals(4L, entry.frameIndex());
    assertEquals(101, state.trackingHistory().latest().orElseThrow().subband());
    assertEquals(101, state.view().lastSubband());
  }

  @Test
  void renderWithoutImageLeavesLogEmpty() throws Exception {
    ObservationState state = beginState();
    RenderDispatcher dispatcher =
        dispatcher(new CountingRenderer(), state, new RecordingMetricsPort(), new RenderDispatcher.Settings(1, 4, 1));
    dispatcher.start();
    dispatcher.offer(block(0, 100), new CancellationToken());
    assertTrue(dispatcher.drain(Duration.ofSeconds(5)));

    assertTrue(state.imageLog().isEmpty());
    assertNull(state.view().lastSubband());
  }

  @Test
  void fullQueueBlocksProducerUntilWorkerFrees() throws Exception {
    ObservationState state = beginState();
    BlockingRenderer renderer = new BlockingRenderer();
    RenderDispatcher dispatcher =
        dispatcher(renderer, state, new RecordingMetricsPort(), new RenderDispatcher.Settings(1, 1, 1));
    dispatcher.start();
    CancellationToken token = new CancellationToken();

    dispatcher.offer(block(0, 100), token);
    assertTrue(renderer.started.await(5, TimeUnit.SECONDS));
    dispatcher.offer(block(1, 101), token);

    AtomicReference<DispatchDecision> third = new AtomicReference<>();
    Thread producer = new Thread(() -> third.set(dispatcher.offer(block(2, 102), token)), "producer");
    producer.start();
    producer.join(300);
    assertTrue(producer.isAlive(), "producer should block while the queue is full");
    assertNull(third.get());

    renderer.release.countDown();
    producer.join(5_000);
    assertFalse(producer.isAlive());
    assertEquals(DispatchDecision.SUBMITTED, third.get());
    assertTrue(dispatcher.drain(Duration.ofSeconds(5)));
    assertEquals(3, dispatcher.summary().completed());
    assertEquals(0, state.pendingCount());
  }

  @Test
  void drainTimeoutLeavesRunningRenderAlone() throws Exception {
    ObservationState state = beginState();
    BlockingRenderer renderer = new BlockingRenderer();
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    RenderDispatcher dispatcher = dispatcher(renderer, state, metrics, new RenderDispatcher.Settings(1, 1, 1));
    dispatcher.start();

    dispatcher.offer(block(0, 100), new CancellationToken());
    assertTrue(renderer.started.await(5, TimeUnit.SECONDS));

    assertFalse(dispatcher.drain(Duration.ofMillis(50)));
    assertEquals(1, metrics.count("observe.dispatch.drain.timeout"));
    assertFalse(renderer.interrupted.get());

    renderer.release.countDown();
    assertTrue(dispatcher.drain(Duration.ofSeconds(5)));
    assertEquals(1, dispatcher.summary().completed());
  }

  @Test
  void offerBeforeStartFails() throws Exception {
    RenderDispatcher dispatcher = dispatcher(
        new CountingRenderer(), beginState(), new RecordingMetricsPort(), new RenderDispatcher.Settings(1, 1, 1));
    assertThrows(IllegalStateException.class, () -> dispatcher.offer(block(0, 100), new CancellationToken()));
  }

  @Test
  void settingsRejectNonPositiveValues() {
    assertThrows(IllegalArgumentException.class, () -> new RenderDispatcher.Settings(0, 1, 1));
    assertThrows(IllegalArgumentException.class, () -> new RenderDispatcher.Settings(1, 0, 1));
    assertThrows(IllegalArgumentException.class, () -> new RenderDispatcher.Settings(1, 1, 0));
  }

  private RenderDispatcher dispatcher(
      RendererPort renderer, ObservationState state, RecordingMetricsPort metrics, RenderDispatcher.Settings settings)
      throws Exception {
    ObservationSession session = ObservationSession.create(imagesRoot, START);
    return new RenderDispatcher(renderer, state, metrics, settings, session, STATION, null);
  }

  private static ObservationState beginState() {
    ObservationState state = new ObservationState();
    state.tryBegin(new RunParameters(1, 1, 1.5, 50));
    return state;
  }

  private static XstBlock block(long sequence, int subband) {
    return new XstBlock(sequence, START.plusSeconds(sequence), subband, 1, new byte[16]);
  }

  private static final class CountingRenderer implements RendererPort {
    private final AtomicInteger calls = new AtomicInteger();
    private final Set<Long> sequences = ConcurrentHashMap.newKeySet();

    @Override
    public RenderResult render(RenderRequest request) {
      calls.incrementAndGet();
      sequences.add(request.block().sequence());
      return RenderResult.empty();
    }
  }

  private static final class BlockingRenderer implements RendererPort {
    private final CountDownLatch started = new CountDownLatch(1);
    private final CountDownLatch release = new CountDownLatch(1);
    private final AtomicInteger calls = new AtomicInteger();
    private final AtomicBoolean interrupted = new AtomicBoolean();

    @Override
    public RenderResult render(RenderRequest request) throws InterruptedException {
      calls.incrementAndGet();
      started.countDown();
      try {
        release.await();
      } catch (InterruptedException ie) {
        interrupted.set(true);
        throw ie;
      }
      return RenderResult.empty();
    }
  }
}
