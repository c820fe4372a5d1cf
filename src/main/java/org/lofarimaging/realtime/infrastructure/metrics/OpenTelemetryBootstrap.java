package org.lofarimaging.realtime.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.metrics.MeterProvider;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import java.io.IOException;
import java.io.InputStream;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.TimeUnit;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates the meter the pipeline records into.
 *
 * <p>Settings come from the {@code otel.*} system properties, which the CLI fills from {@code metricsExporter},
 * {@code otelEndpoint} and {@code otelResourceAttributes}, and fall back to the standard {@code OTEL_*}
 * environment variables. The resource names the service and, when known, the station being observed, so one
 * collector can take metrics from several stations. A broken exporter setup leaves the pipeline with a noop
 * meter; metrics never stop an observation.</p>
 */
final class OpenTelemetryBootstrap {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryBootstrap.class);
  static final String INSTRUMENTATION_SCOPE = "org.lofarimaging.realtime";
  static final AttributeKey<String> STATION = AttributeKey.stringKey("lofar.station");
  private static final String DEFAULT_ENDPOINT = "http://localhost:4317";
  private static final Duration EXPORT_INTERVAL = Duration.ofSeconds(30);
  private static final long FLUSH_TIMEOUT_SECONDS = 5;
  private static final String POM_PROPERTIES = "/META-INF/maven/org.lofarimaging/lofar-realtime/pom.properties";

  private OpenTelemetryBootstrap() {}

  /**
   * Builds a meter from the process settings.
   *
   * @param stationName station tagged on the resource, or {@code null}
   * @return handle owning the meter provider
   */
  static MeterHandle initialize(String stationName) {
    return initialize(ExportSettings.read(System::getProperty, System::getenv), stationName);
  }

  static MeterHandle initialize(ExportSettings settings, String stationName) {
    if (!settings.enabled()) {
      log.info("Metrics export disabled; recording into a noop meter");
      return MeterHandle.noop();
    }
    try {
      OtlpGrpcMetricExporter exporter = OtlpGrpcMetricExporter.builder().setEndpoint(settings.endpoint()).build();
      MetricReader reader = PeriodicMetricReader.builder(exporter).setInterval(EXPORT_INTERVAL).build();
      MeterHandle handle = open(reader, resource(stationName, parseResourceAttributes(settings.resourceAttributes())));
      log.info("Exporting metrics over OTLP to {} every {} s", settings.endpoint(), EXPORT_INTERVAL.toSeconds());
      return handle;
    } catch (RuntimeException ex) {
      log.error("Could not set up OTLP metrics export to {}; observing without metrics", settings.endpoint(), ex);
      return MeterHandle.noop();
    }
  }

  /** Wires a provider around the supplied reader, typically an in-memory reader in tests. */
  static MeterHandle forTesting(MetricReader reader) {
    return open(Objects.requireNonNull(reader, "reader"), resource("LV614", Attributes.empty()));
  }

  private static MeterHandle open(MetricReader reader, Resource resource) {
    SdkMeterProvider provider =
        SdkMeterProvider.builder().setResource(resource).registerMetricReader(reader).build();
    Meter meter =
        provider.meterBuilder(INSTRUMENTATION_SCOPE).setInstrumentationVersion(serviceVersion()).build();
    return new MeterHandle(meter, provider);
  }

  static Resource resource(String stationName, Attributes extra) {
    AttributesBuilder service =
        Attributes.builder()
            .put("service.name", "lofar-realtime")
            .put("service.namespace", "org.lofarimaging")
            .put("service.version", serviceVersion())
            .put("service.instance.id", hostName());
    if (stationName != null && !stationName.isBlank()) {
      service.put(STATION, stationName.trim().toUpperCase(Locale.ROOT));
    }
    return Resource.getDefault().merge(Resource.create(service.build())).merge(Resource.create(extra));
  }

  /**
   * Parses {@code k1=v1,k2=v2}. Tokens without a key or a value are logged and skipped.
   */
  static Attributes parseResourceAttributes(String raw) {
    AttributesBuilder builder = Attributes.builder();
    if (raw == null) {
      return builder.build();
    }
    for (String token : raw.split(",")) {
      String pair = token.trim();
      int eq = pair.indexOf('=');
      if (pair.isEmpty()) {
        continue;
      }
      if (eq <= 0 || eq == pair.length() - 1) {
        log.warn("Skipping resource attribute '{}': expected key=value", pair);
        continue;
      }
      builder.put(pair.substring(0, eq).trim(), pair.substring(eq + 1).trim());
    }
    return builder.build();
  }

  private static String hostName() {
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException ex) {
      log.debug("Host name unavailable for service.instance.id: {}", ex.getMessage());
      return "unknown-host";
    }
  }

  static String serviceVersion() {
    String manifest = OpenTelemetryBootstrap.class.getPackage().getImplementationVersion();
    if (manifest != null && !manifest.isBlank()) {
      return manifest;
    }
    try (InputStream in = OpenTelemetryBootstrap.class.getResourceAsStream(POM_PROPERTIES)) {
      if (in != null) {
        Properties props = new Properties();
        props.load(in);
        return props.getProperty("version", "0.0.0-dev");
      }
    } catch (IOException ex) {
      log.debug("Could not read {}: {}", POM_PROPERTIES, ex.getMessage());
    }
    return "0.0.0-dev";
  }

  /**
   * Export settings resolved from properties first and environment second.
   *
   * @param enabled {@code false} for exporter {@code none}
   * @param endpoint OTLP gRPC endpoint
   * @param resourceAttributes raw {@code k=v} list, possibly empty
   */
  record ExportSettings(boolean enabled, String endpoint, String resourceAttributes) {
    static ExportSettings read(UnaryOperator<String> property, UnaryOperator<String> env) {
      String exporter = pick(property.apply("otel.metrics.exporter"), env.apply("OTEL_METRICS_EXPORTER"), "otlp");
      boolean enabled = !"none".equals(exporter.toLowerCase(Locale.ROOT));
      if (enabled && !"otlp".equals(exporter.toLowerCase(Locale.ROOT))) {
        log.warn("Unknown metrics exporter '{}'; exporting over otlp", exporter);
      }
      return new ExportSettings(
          enabled,
          pick(property.apply("otel.exporter.otlp.endpoint"), env.apply("OTEL_EXPORTER_OTLP_ENDPOINT"),
              DEFAULT_ENDPOINT),
          pick(property.apply("otel.resource.attributes"), env.apply("OTEL_RESOURCE_ATTRIBUTES"), ""));
    }

    private static String pick(String preferred, String fallback, String otherwise) {
      if (preferred != null && !preferred.isBlank()) {
        return preferred.trim();
      }
      return fallback != null && !fallback.isBlank() ? fallback.trim() : otherwise;
    }
  }

  /** Owns the SDK provider behind a meter; the noop handle owns nothing. */
  static final class MeterHandle implements AutoCloseable {
    private final Meter meter;
    private final SdkMeterProvider provider;

    private MeterHandle(Meter meter, SdkMeterProvider provider) {
      this.meter = meter;
      this.provider = provider;
    }

    static MeterHandle noop() {
      return new MeterHandle(MeterProvider.noop().get(INSTRUMENTATION_SCOPE), null);
    }

    Meter meter() {
      return meter;
    }

    boolean isNoop() {
      return provider == null;
    }

    void forceFlush() {
      if (provider != null) {
        await(provider.forceFlush(), "flush");
      }
    }

    @Override
    public void close() {
      if (provider != null) {
        await(provider.shutdown(), "shutdown");
      }
    }

    private static void await(CompletableResultCode pending, String what) {
      if (!pending.join(FLUSH_TIMEOUT_SECONDS, TimeUnit.SECONDS).isSuccess()) {
        log.warn("Metrics {} did not complete within {} s", what, FLUSH_TIMEOUT_SECONDS);
      }
    }
  }
}
