package org.lofarimaging.realtime.application.pipeline;

import java.util.Objects;

/**
 * Result of one render task, aggregated by the {@link RenderDispatcher}.
 *
 * @param sequence block sequence
 * @param subband block subband
 * @param kind how the task ended
 * @param durationSeconds wall time spent in the task
 * @param failureMessage failure description for {@link Kind#FAILED}, otherwise {@code null}
 * @since 0.1.0
 */
public record RenderOutcome(long sequence, int subband, Kind kind, double durationSeconds, String failureMessage) {
  /** Terminal states of a render task. */
  public enum Kind {
    COMPLETED,
    FAILED,
    CANCELLED
  }

  public RenderOutcome {
    Objects.requireNonNull(kind, "kind");
  }

  static RenderOutcome completed(long sequence, int subband, double durationSeconds) {
    return new RenderOutcome(sequence, subband, Kind.COMPLETED, durationSeconds, null);
  }

  static RenderOutcome failed(long sequence, int subband, double durationSeconds, Throwable cause) {
    String message = cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
    return new RenderOutcome(sequence, subband, Kind.FAILED, durationSeconds, message);
  }

  static RenderOutcome cancelled(long sequence, int subband) {
    return new RenderOutcome(sequence, subband, Kind.CANCELLED, 0d, null);
  }
}
