package org.lofarimaging.realtime.api;

import java.io.IOException;
import java.io.UncheckedIOException;
import org.lofarimaging.realtime.application.pipeline.ObservationSetupException;

/**
 * Process exit status of the command-line tools. Scripts that restart observations key off these values: a
 * {@link #CONFIG_ERROR} needs an operator, an {@link #IO_ERROR} is usually worth a retry.
 *
 * @since 0.1.0
 */
public enum ExitCode {
  SUCCESS(0),
  /** Unknown command, malformed {@code key=value} or a value out of range. */
  INVALID_ARGS(2),
  /** Reading the stream or writing the observation directory failed. */
  IO_ERROR(3),
  /** YAML file unusable, or the observation could not be set up (no subband range, stream not openable). */
  CONFIG_ERROR(4),
  RUNTIME_FAILURE(5),
  /** Stopped by SIGINT; the shell convention of 128 + 2. */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  /**
   * Classifies the failure that ended an observation.
   *
   * @param failure exception recorded by the observation service
   * @return {@link #CONFIG_ERROR} for setup failures, {@link #IO_ERROR} for I/O failures, otherwise
   *     {@link #RUNTIME_FAILURE}
   */
  static ExitCode forObservationFailure(Throwable failure) {
    if (failure instanceof ObservationSetupException) {
      return CONFIG_ERROR;
    }
    if (failure instanceof IOException || failure instanceof UncheckedIOException) {
      return IO_ERROR;
    }
    return RUNTIME_FAILURE;
  }
}
