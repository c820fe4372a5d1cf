package org.lofarimaging.realtime.application.state;

/**
 * Run configuration echoed back in the status snapshot.
 *
 * @param threads render worker count
 * @param step decimation step
 * @param heightMetres imaging height in metres
 * @param extentMetres image half-width in metres
 * @since 0.1.0
 */
public record RunParameters(int threads, int step, double heightMetres, double extentMetres) {
  /** Placeholder used before the first observation. */
  public static final RunParameters NONE = new RunParameters(0, 0, 0d, 0d);
}
