package org.lofarimaging.realtime.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterTest {
  private static final AttributeKey<String> METRIC_KEY = AttributeKey.stringKey("lofar.metric.key");

  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    adapter = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.forTesting(reader));
  }

  @AfterEach
  void tearDown() {
    if (adapter != null) {
      adapter.close();
    }
  }

  @Test
  void incrementRecordsCounterWithResourceAndKeyAttribute() {
    adapter.increment("observe.block.read");
    adapter.increment("observe.block.read");
    adapter.increment("observe.block.read");
    adapter.forceFlush();

    MetricData counter = find(reader.collectAllMetrics(), "observe.block.read").orElseThrow();
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(3L, point.getValue());
    assertEquals("observe.block.read", point.getAttributes().get(METRIC_KEY));

    assertEquals("lofar-realtime", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
    assertEquals("org.lofarimaging", counter.getResource().getAttribute(AttributeKey.stringKey("service.namespace")));
    String instance = counter.getResource().getAttribute(AttributeKey.stringKey("service.instance.id"));
    assertTrue(instance != null && !instance.isBlank(), "Service instance id should be provided");
    assertEquals("LV614", counter.getResource().getAttribute(OpenTelemetryBootstrap.STATION));
  }

  @Test
  void observeRecordsHistogram() {
    adapter.observe("observe.render.latencyMillis", 120);
    adapter.observe("observe.render.latencyMillis", 80);

    MetricData histogram = find(reader.collectAllMetrics(), "observe.render.latencymillis").orElseThrow();
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(200d, point.getSum());
    assertEquals("observe.render.latencyMillis", point.getAttributes().get(METRIC_KEY));
  }

  @Test
  void sanitizesMetricNames() {
    assertEquals("observe.render.latencymillis", OpenTelemetryMetricsAdapter.sanitizeName("observe.render.latencyMillis"));
    assertEquals("m9lives", OpenTelemetryMetricsAdapter.sanitizeName("9lives"));
    assertEquals("observe_queue_depth", OpenTelemetryMetricsAdapter.sanitizeName("observe queue/depth"));
    assertEquals("lofar.metric", OpenTelemetryMetricsAdapter.sanitizeName(" "));
  }

  @Test
  void unitsFollowMetricKeys() {
    assertEquals("ms", OpenTelemetryMetricsAdapter.unitFor("observe.render.latencyMillis"));
    assertEquals("By", OpenTelemetryMetricsAdapter.unitFor("observe.stream.bytes"));
    assertEquals("{block}", OpenTelemetryMetricsAdapter.unitFor("observe.block.decimated"));
    assertEquals("{block}", OpenTelemetryMetricsAdapter.unitFor("observe.stream.blocks"));
    assertEquals("{render}", OpenTelemetryMetricsAdapter.unitFor("observe.render.queue.depth"));
    assertEquals("1", OpenTelemetryMetricsAdapter.unitFor("observe.dispatch.drain.timeout"));
  }

  @Test
  void propertiesWinOverEnvironment() {
    Map<String, String> props = Map.of("otel.exporter.otlp.endpoint", " http://collector:4317 ");
    Map<String, String> env = Map.of(
        "OTEL_EXPORTER_OTLP_ENDPOINT", "http://ignored:4317",
        "OTEL_RESOURCE_ATTRIBUTES", "site=dwingeloo");

    OpenTelemetryBootstrap.ExportSettings settings = OpenTelemetryBootstrap.ExportSettings.read(props::get, env::get);

    assertTrue(settings.enabled());
    assertEquals("http://collector:4317", settings.endpoint());
    assertEquals("site=dwingeloo", settings.resourceAttributes());
  }

  @Test
  void exporterNoneGivesNoopHandle() {
    Map<String, String> env = Map.of("OTEL_METRICS_EXPORTER", "NONE");
    OpenTelemetryBootstrap.ExportSettings settings =
        OpenTelemetryBootstrap.ExportSettings.read(key -> null, env::get);

    assertFalse(settings.enabled());
    try (OpenTelemetryBootstrap.MeterHandle handle = OpenTelemetryBootstrap.initialize(settings, "CS002")) {
      assertTrue(handle.isNoop());
    }
  }

  @Test
  void stationIsOptionalOnTheResource() {
    Resource withStation = OpenTelemetryBootstrap.resource(" cs002 ", Attributes.empty());
    Resource without = OpenTelemetryBootstrap.resource(null, Attributes.empty());

    assertEquals("CS002", withStation.getAttribute(OpenTelemetryBootstrap.STATION));
    assertNull(without.getAttribute(OpenTelemetryBootstrap.STATION));
  }

  @Test
  void parsesResourceAttributesSkippingMalformedTokens() {
    Attributes attributes =
        OpenTelemetryBootstrap.parseResourceAttributes("deployment.environment=lab, broken, =x, station=LV614");
    assertEquals(2, attributes.size());
    assertEquals("lab", attributes.get(AttributeKey.stringKey("deployment.environment")));
    assertEquals("LV614", attributes.get(AttributeKey.stringKey("station")));
    assertTrue(OpenTelemetryBootstrap.parseResourceAttributes(null).isEmpty());
  }

  @Test
  void noOpAdapterDropsUpdatesButRejectsNullKeys() {
    NoOpMetricsAdapter noop = new NoOpMetricsAdapter();
    noop.increment("observe.block.read");
    noop.observe("observe.stream.bytes", 10);
    assertTrue(reader.collectAllMetrics().isEmpty());
    assertThrows(NullPointerException.class, () -> noop.increment(null));
  }

  private static Optional<MetricData> find(Collection<MetricData> metrics, String name) {
    return metrics.stream().filter(metric -> metric.getName().equals(name)).findFirst();
  }
}
