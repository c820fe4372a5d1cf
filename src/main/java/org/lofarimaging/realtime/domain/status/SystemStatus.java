package org.lofarimaging.realtime.domain.status;

/**
 * Coarse lifecycle status shown to the observer.
 *
 * @since 0.1.0
 */
public enum SystemStatus {
  IDLE("Idle"),
  WAITING_FOR_FILE("Waiting for file..."),
  RUNNING("Running"),
  STOPPING("Stopping...");

  private final String label;

  SystemStatus(String label) {
    this.label = label;
  }

  /** Human-readable label used in status output. */
  public String label() {
    return label;
  }
}
