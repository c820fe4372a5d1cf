package org.lofarimaging.realtime.application.status;

import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.lofarimaging.realtime.application.port.StatusSink;
import org.lofarimaging.realtime.application.state.ObservationState;
import org.lofarimaging.realtime.domain.observation.ObservationSession;
import org.lofarimaging.realtime.domain.status.StatusSnapshot;
import org.lofarimaging.realtime.infrastructure.exec.ExecutorFactories;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publishes the status snapshot on a fixed schedule: one summary log line plus {@code status.json} in the
 * observation directory. Publication failures are logged and the schedule continues.
 *
 * @since 0.1.0
 */
public final class StatusReporter implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(StatusReporter.class);

  private final StatusAggregator aggregator;
  private final StatusSink sink;
  private final ObservationState state;
  private final Duration interval;
  private ScheduledExecutorService scheduler;

  public StatusReporter(StatusAggregator aggregator, StatusSink sink, ObservationState state, Duration interval) {
    this.aggregator = Objects.requireNonNull(aggregator, "aggregator");
    this.sink = Objects.requireNonNull(sink, "sink");
    this.state = Objects.requireNonNull(state, "state");
    this.interval = Objects.requireNonNull(interval, "interval");
    if (interval.isZero() || interval.isNegative()) {
      throw new IllegalArgumentException("interval must be positive");
    }
  }

  /** Starts periodic publication. */
  public synchronized void start() {
    if (scheduler != null) {
      throw new IllegalStateException("Status reporter already started");
    }
    scheduler = ExecutorFactories.newDaemonScheduler("status-reporter");
    long millis = interval.toMillis();
    scheduler.scheduleAtFixedRate(this::publishOnce, millis, millis, TimeUnit.MILLISECONDS);
  }

  /**
   * Publishes one snapshot now.
   *
   * @return the published snapshot
   */
  public StatusSnapshot publishOnce() {
    StatusSnapshot snapshot = aggregator.snapshot();
    log.info("Status: {}", snapshot.summaryLine());
    Optional<ObservationSession> session = state.session();
    if (session.isPresent()) {
      try {
        sink.publish(snapshot, session.get().statusFile());
      } catch (IOException | RuntimeException ex) {
        log.warn("Failed to write status file {}", session.get().statusFile(), ex);
      }
    }
    return snapshot;
  }

  @Override
  public synchronized void close() {
    if (scheduler == null) {
      return;
    }
    scheduler.shutdownNow();
    scheduler = null;
    publishOnce();
  }
}
