package org.lofarimaging.realtime.domain.status;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Rolling window over the most recent render durations, in completion order.
 *
 * <p>Not thread-safe; the owner guards it with its state lock.</p>
 *
 * @since 0.1.0
 */
public final class ProcessingTimeWindow {
  /** Number of durations retained. */
  public static final int DEFAULT_CAPACITY = 10;

  private final int capacity;
  private final Deque<Double> durations;

  public ProcessingTimeWindow() {
    this(DEFAULT_CAPACITY);
  }

  public ProcessingTimeWindow(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive");
    }
    this.capacity = capacity;
    this.durations = new ArrayDeque<>(capacity);
  }

  /**
   * Appends a duration, evicting the oldest once the window is full.
   *
   * @param seconds render wall time in seconds; must be non-negative and finite
   */
  public void record(double seconds) {
    if (!(seconds >= 0) || Double.isInfinite(seconds)) {
      throw new IllegalArgumentException("duration must be a non-negative finite number (was " + seconds + ")");
    }
    if (durations.size() == capacity) {
      durations.removeFirst();
    }
    durations.addLast(seconds);
  }

  /** Mean of the retained durations, or {@code 0} when empty. */
  public double average() {
    if (durations.isEmpty()) {
      return 0d;
    }
    double sum = 0d;
    for (double value : durations) {
      sum += value;
    }
    return sum / durations.size();
  }

  public int size() {
    return durations.size();
  }

  public List<Double> values() {
    return List.copyOf(durations);
  }

  public void clear() {
    durations.clear();
  }
}
