package org.lofarimaging.realtime.application.port;

import java.time.Instant;

/**
 * <strong>What:</strong> Port supplying wall-clock time to the observation pipeline.
 * <p><strong>Why:</strong> Block timestamps name archived artifacts and observation directories; tests inject a
 * fixed clock to make those names deterministic.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe.</p>
 *
 * @since 0.1.0
 * @see org.lofarimaging.realtime.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  long nowMillis();

  /**
   * Returns the current time as an {@link Instant}.
   *
   * @return current instant at millisecond precision
   */
  default Instant now() {
    return Instant.ofEpochMilli(nowMillis());
  }

  /** Default {@link ClockPort} using {@link System#currentTimeMillis()}. */
  ClockPort SYSTEM = System::currentTimeMillis;
}
