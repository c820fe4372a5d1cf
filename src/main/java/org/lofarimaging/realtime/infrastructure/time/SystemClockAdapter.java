package org.lofarimaging.realtime.infrastructure.time;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import org.lofarimaging.realtime.application.port.ClockPort;

/**
 * {@link ClockPort} over a {@link java.time.Clock}, UTC unless told otherwise. Instants are cut to milliseconds,
 * the resolution of block timestamps and session log entries.
 *
 * @since 0.1.0
 */
public final class SystemClockAdapter implements ClockPort {
  private final Clock clock;

  public SystemClockAdapter() {
    this(Clock.systemUTC());
  }

  /**
   * @param clock time source, e.g. {@link Clock#fixed} in tests
   */
  public SystemClockAdapter(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public long nowMillis() {
    return clock.millis();
  }

  @Override
  public Instant now() {
    return clock.instant().truncatedTo(ChronoUnit.MILLIS);
  }
}
