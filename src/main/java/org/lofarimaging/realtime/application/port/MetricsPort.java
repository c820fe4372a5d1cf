package org.lofarimaging.realtime.application.port;

/**
 * Counters and histograms recorded by the tailer, the archive and the render dispatcher. Names are dotted and
 * start with the command, e.g. {@code observe.block.decimated} or {@code observe.render.latencyMillis}.
 *
 * <p>Called from the observation loop and from every render worker at once, so implementations must be
 * thread-safe and must not block.</p>
 *
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier (e.g., {@code observe.block.decimated}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram-style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value (e.g., milliseconds, bytes); semantics defined by the caller
   */
  void observe(String key, long value);
}
