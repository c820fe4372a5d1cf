package org.lofarimaging.realtime.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.lofarimaging.realtime.application.port.MetricsPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Metrics adapter that forwards pipeline counters and histograms to OpenTelemetry.
 *
 * <p>Instruments are created lazily per metric key. Keys are lower-cased and any character outside
 * {@code [a-z0-9._-]} becomes {@code _}; the original key is kept as the {@code lofar.metric.key} attribute.
 * Units follow the key's suffix: {@code ...Millis} is {@code ms}, {@code ...bytes} is {@code By}, block and render
 * counters count {@code {block}} and {@code {render}}.</p>
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  private static final AttributeKey<String> METRIC_KEY_ATTRIBUTE = AttributeKey.stringKey("lofar.metric.key");
  private static final String FALLBACK_METRIC_NAME = "lofar.metric";

  private final OpenTelemetryBootstrap.MeterHandle bootstrap;
  private final Meter meter;
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Histogram> histograms = new ConcurrentHashMap<>();

  /**
   * Creates an adapter exporting as configured by the {@code otel.*} properties.
   *
   * @param stationName station recorded as the {@code lofar.station} resource attribute; may be {@code null}
   */
  public OpenTelemetryMetricsAdapter(String stationName) {
    this(OpenTelemetryBootstrap.initialize(stationName));
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.MeterHandle bootstrap) {
    this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
    this.meter = bootstrap.meter();
    if (bootstrap.isNoop()) {
      log.debug("OpenTelemetry metrics adapter has no exporter");
    }
  }

  @Override
  public void increment(String key) {
    Counter counter = counters.computeIfAbsent(Objects.requireNonNull(key, "key"), this::newCounter);
    counter.instrument().add(1, counter.attributes());
  }

  @Override
  public void observe(String key, long value) {
    Histogram histogram = histograms.computeIfAbsent(Objects.requireNonNull(key, "key"), this::newHistogram);
    histogram.instrument().record(value, histogram.attributes());
  }

  /** Pushes buffered measurements to the exporter. */
  public void forceFlush() {
    bootstrap.forceFlush();
  }

  @Override
  public void close() {
    bootstrap.close();
  }

  private Counter newCounter(String key) {
    String name = sanitizeName(key);
    LongCounter counter =
        meter.counterBuilder(name).setUnit(unitFor(key)).setDescription("Pipeline counter " + key).build();
    return new Counter(counter, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
  }

  private Histogram newHistogram(String key) {
    String name = sanitizeName(key);
    LongHistogram histogram =
        meter.histogramBuilder(name)
            .ofLongs()
            .setUnit(unitFor(key))
            .setDescription("Pipeline distribution " + key)
            .build();
    return new Histogram(histogram, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
  }

  static String unitFor(String key) {
    if (key.endsWith("Millis")) {
      return "ms";
    }
    String lower = key.toLowerCase(Locale.ROOT);
    if (lower.endsWith("bytes")) {
      return "By";
    }
    if (lower.contains(".block") || lower.endsWith(".blocks")) {
      return "{block}";
    }
    if (lower.contains(".render.")) {
      return "{render}";
    }
    return "1";
  }

  static String sanitizeName(String key) {
    if (key == null || key.isBlank()) {
      return FALLBACK_METRIC_NAME;
    }
    String lower = key.trim().toLowerCase(Locale.ROOT);
    StringBuilder result = new StringBuilder(lower.length() + 1);
    if (!Character.isLetter(lower.charAt(0))) {
      result.append('m');
    }
    for (int i = 0; i < lower.length(); i++) {
      char c = lower.charAt(i);
      boolean allowed = (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '_' || c == '-' || c == '.';
      result.append(allowed ? c : '_');
    }
    String sanitized = result.toString();
    if (!sanitized.equals(key)) {
      log.debug("Sanitized metric name '{}' -> '{}'", key, sanitized);
    }
    return sanitized;
  }

  private record Counter(LongCounter instrument, Attributes attributes) {}

  private record Histogram(LongHistogram instrument, Attributes attributes) {}
}
