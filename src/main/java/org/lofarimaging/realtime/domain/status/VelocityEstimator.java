package org.lofarimaging.realtime.domain.status;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * <strong>What:</strong> Estimates the speed of the tracked source from its most recent positions.
 * <p><strong>How:</strong> Walks consecutive pairs from newest to oldest, skips pairs whose time step is not
 * positive or whose timestamps do not parse, and averages up to {@value #MAX_SEGMENTS} segment speeds
 * {@code sqrt(Δx² + Δy²) / Δt}.</p>
 * <p><strong>Thread-safety:</strong> Stateless; callers pass an immutable snapshot of the history.</p>
 *
 * @since 0.1.0
 */
public final class VelocityEstimator {
  /** Maximum number of segments averaged. */
  public static final int MAX_SEGMENTS = 4;

  private VelocityEstimator() {
    // Utility
  }

  /**
   * Estimates the speed in metres per second.
   *
   * @param history tracking samples in append order (oldest first)
   * @return mean speed, or empty when fewer than one valid segment exists
   */
  public static OptionalDouble estimate(List<TrackingSample> history) {
    if (history == null || history.size() < 2) {
      return OptionalDouble.empty();
    }
    double sum = 0d;
    int segments = 0;
    for (int i = history.size() - 1; i > 0 && segments < MAX_SEGMENTS; i--) {
      TrackingSample earlier = history.get(i - 1);
      TrackingSample later = history.get(i);
      if (earlier == null || later == null) {
        continue;
      }
      Optional<Instant> t1 = earlier.instant();
      Optional<Instant> t2 = later.instant();
      if (t1.isEmpty() || t2.isEmpty()) {
        continue;
      }
      double dt = Duration.between(t1.get(), t2.get()).toNanos() / 1_000_000_000d;
      if (dt <= 0) {
        continue;
      }
      double dx = later.xMetres() - earlier.xMetres();
      double dy = later.yMetres() - earlier.yMetres();
      double speed = Math.sqrt(dx * dx + dy * dy) / dt;
      if (Double.isNaN(speed) || Double.isInfinite(speed)) {
        continue;
      }
      sum += speed;
      segments++;
    }
    return segments == 0 ? OptionalDouble.empty() : OptionalDouble.of(sum / segments);
  }
}
