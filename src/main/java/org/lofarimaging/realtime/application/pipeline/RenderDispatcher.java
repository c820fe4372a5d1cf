package org.lofarimaging.realtime.application.pipeline;

import java.lang.Thread.UncaughtExceptionHandler;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.LongAdder;
import org.lofarimaging.realtime.application.port.MetricsPort;
import org.lofarimaging.realtime.application.port.RenderRequest;
import org.lofarimaging.realtime.application.port.RenderResult;
import org.lofarimaging.realtime.application.port.RendererPort;
import org.lofarimaging.realtime.application.state.CancellationToken;
import org.lofarimaging.realtime.application.state.ObservationState;
import org.lofarimaging.realtime.domain.block.XstBlock;
import org.lofarimaging.realtime.domain.observation.ObservationSession;
import org.lofarimaging.realtime.domain.station.StationGeometry;
import org.lofarimaging.realtime.domain.status.ImageLogEntry;
import org.lofarimaging.realtime.domain.status.TrackingSample;
import org.lofarimaging.realtime.infrastructure.exec.ExecutorFactories;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decimates framed blocks and renders the survivors on a bounded worker pool.
 *
 * <p>Each offered block passes the decimation check (1-based block number divisible by the step), then a
 * shutdown checkpoint, and only then counts as pending and goes to the pool. Submission blocks while the pool
 * queue is full. Workers check the cancellation token again before rendering, record timings and image log
 * entries in {@link ObservationState}, and always release their pending count in {@code finally}. A failing
 * render never affects its siblings.</p>
 *
 * <p>Instances cover one observation: call {@link #start()} once, offer blocks from a single producer thread,
 * then {@link #drain(Duration)}.</p>
 *
 * @since 0.1.0
 */
public final class RenderDispatcher {
  private static final Logger log = LoggerFactory.getLogger(RenderDispatcher.class);

  private final RendererPort renderer;
  private final ObservationState state;
  private final MetricsPort metrics;
  private final Settings settings;
  private final ObservationSession session;
  private final StationGeometry station;
  private final Path caltableDir;
  private final String workerThreadPrefix;
  private final UncaughtExceptionHandler workerUncaughtHandler;

  private final LongAdder offered = new LongAdder();
  private final LongAdder decimated = new LongAdder();
  private final LongAdder discarded = new LongAdder();
  private final LongAdder submitted = new LongAdder();
  private final LongAdder rejected = new LongAdder();
  private final LongAdder completed = new LongAdder();
  private final LongAdder failed = new LongAdder();
  private final LongAdder cancelled = new LongAdder();
  private final AtomicReference<String> lastFailure = new AtomicReference<>();

  private volatile ThreadPoolExecutor executor;

  /**
   * Creates a dispatcher for one observation.
   *
   * @param renderer external imager
   * @param state shared observation state receiving counters, timings, and image log entries
   * @param metrics metrics sink
   * @param settings pool size, queue capacity, and decimation step
   * @param session observation directories; images go to {@link ObservationSession#images()}
   * @param station station geometry passed to every render
   * @param caltableDir calibration tables, or {@code null}
   */
  public RenderDispatcher(
      RendererPort renderer,
      ObservationState state,
      MetricsPort metrics,
      Settings settings,
      ObservationSession session,
      StationGeometry station,
      Path caltableDir) {
    this.renderer = Objects.requireNonNull(renderer, "renderer");
    this.state = Objects.requireNonNull(state, "state");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.session = Objects.requireNonNull(session, "session");
    this.station = Objects.requireNonNull(station, "station");
    this.caltableDir = caltableDir;
    this.workerThreadPrefix = "render-" + session.name();
    this.workerUncaughtHandler = this::handleWorkerCrash;
  }

  /** Starts the render pool. */
  public void start() {
    if (executor != null) {
      throw new IllegalStateException("Render dispatcher already started");
    }
    executor =
        ExecutorFactories.newRenderPool(
            settings.workers(), settings.queueCapacity(), workerThreadPrefix, workerUncaughtHandler);
    log.info(
        "Render pool started with {} workers, queue capacity {}, step {}",
        settings.workers(),
        settings.queueCapacity(),
        settings.step());
  }

  /**
   * Offers a block for rendering. Blocks the caller while the render queue is full.
   *
   * @param block framed block, offered in arrival order
   * @param token stop signal of the current observation
   * @return what happened to the block
   */
  public DispatchDecision offer(XstBlock block, CancellationToken token) {
    Objects.requireNonNull(block, "block");
    Objects.requireNonNull(token, "token");
    ThreadPoolExecutor pool = executor;
    if (pool == null) {
      throw new IllegalStateException("Render dispatcher not started");
    }
    offered.increment();

    if (block.blockNumber() % settings.step() != 0) {
      decimated.increment();
      metrics.increment("observe.block.decimated");
      log.debug("Skipping block {} (step {})", block.blockNumber(), settings.step());
      return DispatchDecision.DECIMATED;
    }

    if (token.isCancellationRequested()) {
      discarded.increment();
      metrics.increment("observe.block.discarded.shutdown");
      log.info("Shutdown requested; discarding block {} (subband {})", block.sequence(), block.subband());
      return DispatchDecision.DISCARDED_SHUTDOWN;
    }

    state.incrementPending();
    try {
      pool.execute(() -> aggregate(renderBlock(block, token)));
    } catch (RejectedExecutionException ex) {
      int pending = state.decrementPending();
      rejected.increment();
      metrics.increment("observe.render.rejected");
      log.warn("Render pool refused block {}: {} (pending={})", block.sequence(), ex.getMessage(), pending);
      return DispatchDecision.REJECTED;
    }
    submitted.increment();
    metrics.increment("observe.render.submitted");
    metrics.observe("observe.render.queue.depth", pool.getQueue().size());
    return DispatchDecision.SUBMITTED;
  }

  /**
   * Stops accepting tasks and waits for queued and running renders to finish. Running renders are never
   * interrupted.
   *
   * @param timeout upper bound on the wait
   * @return {@code true} if every task finished within the bound
   */
  public boolean drain(Duration timeout) {
    Objects.requireNonNull(timeout, "timeout");
    ThreadPoolExecutor pool = executor;
    if (pool == null) {
      return true;
    }
    pool.shutdown();
    log.info("Draining render pool ({} queued, {} active)", pool.getQueue().size(), pool.getActiveCount());
    try {
      boolean terminated = pool.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
      if (!terminated) {
        metrics.increment("observe.dispatch.drain.timeout");
        log.warn(
            "Render pool still busy after {} ms ({} pending); leaving renders to finish in the background",
            timeout.toMillis(),
            state.pendingCount());
      }
      return terminated;
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      metrics.increment("observe.dispatch.drain.interrupted");
      log.warn("Interrupted while draining render pool ({} pending)", state.pendingCount());
      return false;
    }
  }

  /** Counters accumulated so far. */
  public DispatchSummary summary() {
    return new DispatchSummary(
        offered.sum(),
        decimated.sum(),
        discarded.sum(),
        submitted.sum(),
        rejected.sum(),
        completed.sum(),
        failed.sum(),
        cancelled.sum(),
        lastFailure.get());
  }

  RenderOutcome renderBlock(XstBlock block, CancellationToken token) {
    long startNanos = System.nanoTime();
    try {
      if (token.isCancellationRequested()) {
        log.info("Shutdown requested; skipping render of block {}", block.sequence());
        return RenderOutcome.cancelled(block.sequence(), block.subband());
      }
      RenderResult result =
          renderer.render(new RenderRequest(block, station, session.images(), caltableDir));
      Objects.requireNonNull(result, "renderer returned null result");
      double seconds = elapsedSeconds(startNanos);

      ImageLogEntry entry =
          result.nearFieldImage()
              .map(image -> new ImageLogEntry(
                  block.timestamp(),
                  session.relativeImagePath(image),
                  block.subband(),
                  ImageLogEntry.STATUS_PROCESSED,
                  seconds,
                  block.sequence()))
              .orElse(null);
      state.recordCompletion(seconds, entry);
      result.tracking().ifPresent(sample -> state.trackingHistory().append(withSubband(sample, block)));

      metrics.observe("observe.render.latencyMillis", Math.round(seconds * 1000d));
      log.debug("Rendered block {} (subband {}) in {} s", block.sequence(), block.subband(), seconds);
      return RenderOutcome.completed(block.sequence(), block.subband(), seconds);
    } catch (Exception ex) {
      double seconds = elapsedSeconds(startNanos);
      log.error("Render of block {} (subband {}) failed", block.sequence(), block.subband(), ex);
      return RenderOutcome.failed(block.sequence(), block.subband(), seconds, ex);
    } finally {
      state.decrementPending();
    }
  }

  private void aggregate(RenderOutcome outcome) {
    switch (outcome.kind()) {
      case COMPLETED -> {
        completed.increment();
        metrics.increment("observe.render.completed");
      }
      case FAILED -> {
        failed.increment();
        lastFailure.set(outcome.failureMessage());
        metrics.increment("observe.render.failed");
      }
      case CANCELLED -> {
        cancelled.increment();
        metrics.increment("observe.render.cancelled");
      }
      default -> throw new IllegalStateException("Unknown outcome " + outcome.kind());
    }
  }

  private static TrackingSample withSubband(TrackingSample sample, XstBlock block) {
    if (sample.subband() != null) {
      return sample;
    }
    return new TrackingSample(
        sample.timestamp(),
        sample.lat(),
        sample.lon(),
        sample.xMetres(),
        sample.yMetres(),
        sample.powerDb(),
        block.subband());
  }

  private static double elapsedSeconds(long startNanos) {
    return (System.nanoTime() - startNanos) / 1_000_000_000d;
  }

  private void handleWorkerCrash(Thread thread, Throwable throwable) {
    metrics.increment("observe.render.worker.uncaught");
    log.error("Render worker {} threw an uncaught exception", thread.getName(), throwable);
  }

  /**
   * Render pool tuning.
   *
   * @param workers worker thread count
   * @param queueCapacity maximum tasks waiting for a worker
   * @param step decimation step; every {@code step}-th block is rendered
   */
  public record Settings(int workers, int queueCapacity, int step) {
    public Settings {
      if (workers < 1) {
        throw new IllegalArgumentException("workers must be positive");
      }
      if (queueCapacity < 1) {
        throw new IllegalArgumentException("queueCapacity must be positive");
      }
      if (step < 1) {
        throw new IllegalArgumentException("step must be positive");
      }
    }
  }
}
