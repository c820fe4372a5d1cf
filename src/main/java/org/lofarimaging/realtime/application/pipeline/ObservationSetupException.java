package org.lofarimaging.realtime.application.pipeline;

/**
 * Signals that an observation cannot start, for example because no subband range could be resolved.
 *
 * @since 0.1.0
 */
public class ObservationSetupException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public ObservationSetupException(String message) {
    super(message);
  }

  public ObservationSetupException(String message, Throwable cause) {
    super(message, cause);
  }
}
