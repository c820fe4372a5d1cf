package org.lofarimaging.realtime.application.status;

import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;
import org.lofarimaging.realtime.application.state.ObservationState;
import org.lofarimaging.realtime.domain.status.StatusSnapshot;
import org.lofarimaging.realtime.domain.status.TrackingSample;
import org.lofarimaging.realtime.domain.status.VelocityEstimator;

/**
 * <strong>What:</strong> Builds {@link StatusSnapshot}s from the shared observation state.
 * <p><strong>Thread-safety:</strong> Safe for any number of concurrent readers. Each lock is taken once, in turn,
 * to copy its fields; averaging and the velocity estimate run after both are released.</p>
 *
 * @since 0.1.0
 */
public final class StatusAggregator {
  /** Newest tracking samples copied per snapshot; enough for the estimator to skip a few unusable segments. */
  static final int TRACKING_WINDOW = 8 * VelocityEstimator.MAX_SEGMENTS;

  private final ObservationState state;

  public StatusAggregator(ObservationState state) {
    this.state = Objects.requireNonNull(state, "state");
  }

  /**
   * Returns the current snapshot.
   *
   * @return snapshot; never {@code null}
   */
  public StatusSnapshot snapshot() {
    ObservationState.View view = state.view();
    List<TrackingSample> history = state.trackingHistory().tail(TRACKING_WINDOW);

    TrackingSample last = history.isEmpty() ? null : history.get(history.size() - 1).rounded();
    OptionalDouble velocity = VelocityEstimator.estimate(history);
    return new StatusSnapshot(
        view.status(),
        view.lastBlockNumber(),
        view.lastSubband(),
        view.pendingCount(),
        StatusSnapshot.round2(view.averageProcessingSeconds()),
        view.currentFile(),
        view.subbandRange(),
        view.runParameters().threads(),
        view.runParameters().step(),
        view.runParameters().heightMetres(),
        view.runParameters().extentMetres(),
        last,
        velocity.isPresent() ? StatusSnapshot.round2(velocity.getAsDouble()) : null);
  }
}
