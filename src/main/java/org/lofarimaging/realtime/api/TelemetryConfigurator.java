package org.lofarimaging.realtime.api;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Map;
import org.lofarimaging.realtime.validation.Strings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Copies telemetry settings from the effective configuration into the system properties read by the
 * OpenTelemetry bootstrap.
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;

  private TelemetryConfigurator() {}

  /**
   * Removes {@code metricsExporter}, {@code otelEndpoint} and {@code otelResourceAttributes} from {@code args}
   * and applies them.
   *
   * @param args mutable effective configuration
   * @return normalized exporter name, {@code otlp} when unset
   * @throws IllegalArgumentException if a value is invalid
   */
  static String configureMetrics(Map<String, String> args) {
    String exporter = "otlp";
    String rawExporter = args.remove("metricsExporter");
    if (rawExporter != null && !rawExporter.isBlank()) {
      exporter = rawExporter.trim().toLowerCase(Locale.ROOT);
      if (!exporter.equals("otlp") && !exporter.equals("none")) {
        throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
      }
      log.debug("Configuring OpenTelemetry metrics exporter: {}", exporter);
      System.setProperty("otel.metrics.exporter", exporter);
    }

    String endpoint = args.remove("otelEndpoint");
    if (endpoint != null && !endpoint.isBlank()) {
      String trimmed = endpoint.trim();
      validateEndpoint(trimmed);
      log.debug("Configuring OTLP endpoint: {}", trimmed);
      System.setProperty("otel.exporter.otlp.endpoint", trimmed);
    }

    String resourceAttributes = args.remove("otelResourceAttributes");
    if (resourceAttributes != null && !resourceAttributes.isBlank()) {
      String trimmed = Strings.requireNonBlank("otelResourceAttributes", resourceAttributes);
      if (trimmed.length() > MAX_RESOURCE_ATTRIBUTES_LENGTH) {
        throw new IllegalArgumentException(
            "otelResourceAttributes length must be <= " + MAX_RESOURCE_ATTRIBUTES_LENGTH);
      }
      System.setProperty("otel.resource.attributes", trimmed);
    }
    return exporter;
  }

  private static void validateEndpoint(String raw) {
    try {
      URI uri = new URI(raw);
      String scheme = uri.getScheme();
      if (scheme == null || (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https"))) {
        throw new IllegalArgumentException("otelEndpoint must use http or https scheme");
      }
      if (uri.getHost() == null || uri.getHost().isBlank()) {
        throw new IllegalArgumentException("otelEndpoint must include a host");
      }
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint must be a valid URI", ex);
    }
  }
}
