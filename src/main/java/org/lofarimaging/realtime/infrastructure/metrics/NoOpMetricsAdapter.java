package org.lofarimaging.realtime.infrastructure.metrics;

import java.util.Objects;
import org.lofarimaging.realtime.application.port.MetricsPort;

/**
 * Selected with {@code metricsExporter=none}. Drops every update but still rejects a {@code null} key, so a
 * station running without a collector fails the same way as one exporting over OTLP.
 *
 * @since 0.1.0
 */
public final class NoOpMetricsAdapter implements MetricsPort {
  @Override
  public void increment(String key) {
    Objects.requireNonNull(key, "key");
  }

  @Override
  public void observe(String key, long value) {
    Objects.requireNonNull(key, "key");
  }
}
