package org.lofarimaging.realtime.application.state;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import org.lofarimaging.realtime.domain.status.TrackingSample;

/**
 * <strong>What:</strong> Append-only history of tracking samples reported by render workers.
 * <p><strong>Thread-safety:</strong> Guarded by its own lock, independent of the observation state lock, so a
 * status read never waits on image-log updates.</p>
 *
 * @since 0.1.0
 */
public final class TrackingHistory {
  private final ReentrantLock lock = new ReentrantLock();
  private final List<TrackingSample> samples = new ArrayList<>();

  public void append(TrackingSample sample) {
    Objects.requireNonNull(sample, "sample");
    lock.lock();
    try {
      samples.add(sample);
    } finally {
      lock.unlock();
    }
  }

  /** Most recent sample, if any. */
  public Optional<TrackingSample> latest() {
    lock.lock();
    try {
      return samples.isEmpty() ? Optional.empty() : Optional.of(samples.get(samples.size() - 1));
    } finally {
      lock.unlock();
    }
  }

  /**
   * Copies at most the newest {@code count} samples, so a reader's cost does not grow with the observation.
   *
   * @param count maximum number of samples
   * @return immutable copy, oldest first
   * @throws IllegalArgumentException if {@code count} is negative
   */
  public List<TrackingSample> tail(int count) {
    if (count < 0) {
      throw new IllegalArgumentException("count must not be negative: " + count);
    }
    lock.lock();
    try {
      int size = samples.size();
      return List.copyOf(samples.subList(Math.max(0, size - count), size));
    } finally {
      lock.unlock();
    }
  }

  public int size() {
    lock.lock();
    try {
      return samples.size();
    } finally {
      lock.unlock();
    }
  }

  /** Forgets all samples; called when a new observation starts. */
  public void clear() {
    lock.lock();
    try {
      samples.clear();
    } finally {
      lock.unlock();
    }
  }
}
