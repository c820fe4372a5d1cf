package org.lofarimaging.realtime.application.pipeline;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.lofarimaging.realtime.application.state.CancellationToken;
import org.lofarimaging.realtime.application.state.ObservationState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Start/stop control surface for observations.
 *
 * <p>{@link #start} admits one observation at a time and runs it on a dedicated non-daemon thread;
 * {@link #stop} signals the running observation and wakes it if it is still waiting for its stream.</p>
 *
 * @since 0.1.0
 */
public final class ObservationService {
  private static final Logger log = LoggerFactory.getLogger(ObservationService.class);

  private final ObservationState state;
  private final ObservationUseCase useCase;
  private final AtomicReference<Thread> worker = new AtomicReference<>();
  private final AtomicReference<Exception> lastFailure = new AtomicReference<>();
  private final AtomicReference<DispatchSummary> lastSummary = new AtomicReference<>();

  public ObservationService(ObservationState state, ObservationUseCase useCase) {
    this.state = Objects.requireNonNull(state, "state");
    this.useCase = Objects.requireNonNull(useCase, "useCase");
  }

  /**
   * Starts an observation unless one is already running or the previous one left renders in flight.
   *
   * @param settings run parameters
   * @return {@code false} if the start was refused
   */
  public synchronized boolean start(ObservationSettings settings) {
    Objects.requireNonNull(settings, "settings");
    Optional<CancellationToken> token = state.tryBegin(settings.runParameters());
    if (token.isEmpty()) {
      log.warn(state.isObserving()
          ? "Observation already running; ignoring start request"
          : "Previous observation still rendering; ignoring start request");
      return false;
    }
    lastFailure.set(null);
    lastSummary.set(null);
    Thread thread = new Thread(() -> runObservation(settings, token.get()), "observation-runner");
    thread.setDaemon(false);
    worker.set(thread);
    thread.start();
    log.info("Observation started (threads={}, step={})", settings.dispatch().workers(), settings.dispatch().step());
    return true;
  }

  /**
   * Requests the running observation to stop. Renders already queued or running finish normally.
   *
   * @return {@code false} if nothing was running
   */
  public boolean stop() {
    if (!state.requestStop()) {
      log.info("No observation running; ignoring stop request");
      return false;
    }
    if (useCase.interruptSetup()) {
      log.info("Stop requested while waiting for stream; setup interrupted");
    } else {
      log.info("Stop requested; draining in-flight renders");
    }
    return true;
  }

  /**
   * Waits for the observation thread to finish.
   *
   * @param timeout maximum wait
   * @return {@code true} if no observation thread is alive afterwards
   * @throws InterruptedException if interrupted while waiting
   */
  public boolean awaitCompletion(Duration timeout) throws InterruptedException {
    Thread thread = worker.get();
    if (thread == null) {
      return true;
    }
    thread.join(Math.max(1L, timeout.toMillis()));
    return !thread.isAlive();
  }

  public boolean isObserving() {
    return state.isObserving();
  }

  /** Failure of the most recent observation, if it failed. */
  public Optional<Exception> lastFailure() {
    return Optional.ofNullable(lastFailure.get());
  }

  /** Dispatch counters of the most recent observation, once it has finished. */
  public Optional<DispatchSummary> lastSummary() {
    return Optional.ofNullable(lastSummary.get());
  }

  private void runObservation(ObservationSettings settings, CancellationToken token) {
    try {
      useCase.run(settings, token).ifPresent(lastSummary::set);
    } catch (Exception ex) {
      lastFailure.set(ex);
      log.error("Observation terminated with failure", ex);
    }
  }
}
