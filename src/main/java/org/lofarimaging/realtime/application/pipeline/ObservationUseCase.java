package org.lofarimaging.realtime.application.pipeline;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.lofarimaging.realtime.application.port.BlockArchivePort;
import org.lofarimaging.realtime.application.port.BlockSource;
import org.lofarimaging.realtime.application.port.BlockSourceFactory;
import org.lofarimaging.realtime.application.port.ClockPort;
import org.lofarimaging.realtime.application.port.MetricsPort;
import org.lofarimaging.realtime.application.port.RendererPort;
import org.lofarimaging.realtime.application.port.SessionLogPort;
import org.lofarimaging.realtime.application.port.StreamSourceLocator;
import org.lofarimaging.realtime.application.port.SubbandRangeResolver;
import org.lofarimaging.realtime.application.state.CancellationToken;
import org.lofarimaging.realtime.application.state.ObservationState;
import org.lofarimaging.realtime.domain.block.SubbandCycler;
import org.lofarimaging.realtime.domain.block.SubbandRange;
import org.lofarimaging.realtime.domain.block.XstBlock;
import org.lofarimaging.realtime.domain.observation.ObservationSession;
import org.lofarimaging.realtime.domain.status.SystemStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Runs one observation end to end: creates the observation directory, waits for the stream, resolves the
 * subband range, then reads, archives, and dispatches blocks until the observation is stopped.
 *
 * <p>On every exit path the render pool is drained, the session log is written, the stream is closed, and the
 * state returns to {@link SystemStatus#IDLE}. A setup failure is rethrown after that cleanup. Runs are
 * sequential; a second concurrent {@link #run} call is rejected.</p>
 *
 * @since 0.1.0
 */
public final class ObservationUseCase {
  private static final Logger log = LoggerFactory.getLogger(ObservationUseCase.class);

  private final ObservationState state;
  private final StreamSourceLocator sourceLocator;
  private final BlockSourceFactory sourceFactory;
  private final SubbandRangeResolver rangeResolver;
  private final BlockArchivePort archive;
  private final RendererPort renderer;
  private final SessionLogPort sessionLog;
  private final MetricsPort metrics;
  private final ClockPort clock;

  private final AtomicReference<Thread> runThread = new AtomicReference<>();
  private final AtomicReference<Thread> setupThread = new AtomicReference<>();

  /**
   * Wires the observation pipeline.
   *
   * @param state shared observation state
   * @param sourceLocator waits for the stream file
   * @param sourceFactory creates the block source over the stream file
   * @param rangeResolver resolves the subband range
   * @param archive persists every framed block
   * @param renderer external imager
   * @param sessionLog writes {@code session_log.json}
   * @param metrics metrics sink
   * @param clock wall clock for block timestamps and directory names
   */
  public ObservationUseCase(
      ObservationState state,
      StreamSourceLocator sourceLocator,
      BlockSourceFactory sourceFactory,
      SubbandRangeResolver rangeResolver,
      BlockArchivePort archive,
      RendererPort renderer,
      SessionLogPort sessionLog,
      MetricsPort metrics,
      ClockPort clock) {
    this.state = Objects.requireNonNull(state, "state");
    this.sourceLocator = Objects.requireNonNull(sourceLocator, "sourceLocator");
    this.sourceFactory = Objects.requireNonNull(sourceFactory, "sourceFactory");
    this.rangeResolver = Objects.requireNonNull(rangeResolver, "rangeResolver");
    this.archive = Objects.requireNonNull(archive, "archive");
    this.renderer = Objects.requireNonNull(renderer, "renderer");
    this.sessionLog = Objects.requireNonNull(sessionLog, "sessionLog");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Runs the observation on the calling thread until {@code token} is cancelled or the observing flag clears.
   *
   * @param settings run parameters
   * @param token stop signal issued by {@link ObservationState#tryBegin}
   * @return dispatch counters of the run, or empty when the run stopped before dispatching started
   * @throws Exception if setup fails (no range, unopenable stream, unwritable directory) or closing fails
   */
  public Optional<DispatchSummary> run(ObservationSettings settings, CancellationToken token) throws Exception {
    Objects.requireNonNull(settings, "settings");
    Objects.requireNonNull(token, "token");
    if (!runThread.compareAndSet(null, Thread.currentThread())) {
      throw new IllegalStateException("Observation already running");
    }
    Exception primaryFailure = null;
    ObservationSession session = null;
    RenderDispatcher dispatcher = null;
    BlockSource source = null;
    boolean interrupted = false;
    long blocksRead = 0;
    try {
      session = ObservationSession.create(settings.imagesRoot(), clock.now());
      state.attachSession(session);
      MDC.put("observation", session.name());
      log.info("Observation directory created at {}", session.root());

      Path streamFile;
      SubbandRange range;
      setupThread.set(Thread.currentThread());
      try {
        state.setStatus(SystemStatus.WAITING_FOR_FILE);
        log.info("Waiting for XST stream in {}", settings.inputDirectory());
        streamFile = sourceLocator.awaitSource(settings.inputDirectory());
        if (token.isCancellationRequested()) {
          log.info("Stop requested before stream setup completed");
          return Optional.empty();
        }
        state.setStatus(SystemStatus.RUNNING);
        state.setCurrentFile(streamFile.toString());
        log.info("Found XST stream {}", streamFile);
        range = rangeResolver.resolve(settings.inputDirectory());
      } finally {
        setupThread.set(null);
      }
      state.setSubbandRange(range);
      log.info("Subband range {} ({} subbands per cycle)", range, range.width());

      int dimension = settings.station().dimension();
      source = sourceFactory.create(streamFile, XstBlock.sizeInBytes(dimension));
      source.start();

      dispatcher =
          new RenderDispatcher(
              renderer, state, metrics, settings.dispatch(), session, settings.station(), settings.caltableDir());
      dispatcher.start();

      while (state.isObserving() && !token.isCancellationRequested()) {
        Optional<byte[]> maybeBlock;
        try {
          maybeBlock = source.poll();
        } catch (InterruptedException ie) {
          interrupted = true;
          break;
        }
        if (maybeBlock.isEmpty()) {
          continue;
        }
        accept(maybeBlock.get(), blocksRead++, range, dimension, session, dispatcher, token);
        if (Thread.currentThread().isInterrupted()) {
          interrupted = true;
          break;
        }
      }
      // Whole blocks already read are archived; the cancelled token keeps them from being rendered.
      interrupted |= Thread.interrupted();
      long flushed = 0;
      for (Optional<byte[]> rest = source.pollBuffered(); rest.isPresent(); rest = source.pollBuffered()) {
        accept(rest.get(), blocksRead++, range, dimension, session, dispatcher, token);
        flushed++;
      }
      if (flushed > 0) {
        log.info("Archived {} blocks still buffered when the loop stopped", flushed);
      }
      log.info("Observation loop finished after {} blocks", blocksRead);
    } catch (InterruptedException ie) {
      interrupted = true;
      if (token.isCancellationRequested()) {
        log.info("Observation stopped during setup");
      } else {
        log.warn("Observation setup interrupted");
      }
    } catch (Exception setupFailure) {
      log.error("Observation failed", setupFailure);
      primaryFailure = setupFailure;
    } finally {
      // Clear a pending stop interrupt so the drain below can wait.
      interrupted |= Thread.interrupted();
      if (dispatcher != null) {
        if (!dispatcher.drain(settings.drainTimeout())) {
          log.warn("{} renders still running; new observations are refused until they finish",
              state.pendingCount());
        }
        DispatchSummary summary = dispatcher.summary();
        log.info(
            "Render summary: submitted={} completed={} failed={} cancelled={} decimated={} discarded={}",
            summary.submitted(),
            summary.completed(),
            summary.failed(),
            summary.cancelled(),
            summary.decimated(),
            summary.discarded());
      }
      if (session != null) {
        try {
          sessionLog.save(session.sessionLog(), state.imageLog());
          log.info("Session log saved to {}", session.sessionLog());
        } catch (IOException saveFailure) {
          log.error("Failed to save session log {}", session.sessionLog(), saveFailure);
          if (primaryFailure == null) {
            primaryFailure = saveFailure;
          }
        }
      }
      if (source != null) {
        try {
          source.close();
        } catch (Exception closeFailure) {
          log.error("Failed to close XST stream", closeFailure);
          if (primaryFailure == null) {
            primaryFailure = closeFailure;
          }
        }
      }
      state.finish();
      log.info("Observation finished; status {}", state.status().label());
      MDC.remove("observation");
      runThread.set(null);
      if (interrupted && !token.isCancellationRequested()) {
        Thread.currentThread().interrupt();
      }
    }

    if (primaryFailure != null) {
      throw primaryFailure;
    }
    return Optional.ofNullable(dispatcher).map(RenderDispatcher::summary);
  }

  /**
   * Interrupts the run thread if it is still waiting for the stream file or its descriptor.
   *
   * @return {@code true} if a waiting thread was interrupted
   */
  public boolean interruptSetup() {
    Thread waiting = setupThread.get();
    if (waiting == null) {
      return false;
    }
    waiting.interrupt();
    return true;
  }

  private void accept(
      byte[] bytes,
      long sequence,
      SubbandRange range,
      int dimension,
      ObservationSession session,
      RenderDispatcher dispatcher,
      CancellationToken token) {
    XstBlock block = new XstBlock(sequence, clock.now(), SubbandCycler.subband(sequence, range), dimension, bytes);
    metrics.increment("observe.block.read");
    archiveBlock(block, range, session);
    state.recordBlockRead(block.blockNumber());
    dispatcher.offer(block, token);
  }

  private void archiveBlock(XstBlock block, SubbandRange range, ObservationSession session) {
    try {
      Path written = archive.persist(block, range, session.blocks());
      metrics.increment("observe.block.persisted");
      log.debug("Archived block {} (subband {}) to {}", block.sequence(), block.subband(), written);
    } catch (IOException ex) {
      metrics.increment("observe.block.persist.error");
      log.error("Failed to archive block {} (subband {})", block.sequence(), block.subband(), ex);
    }
  }
}
