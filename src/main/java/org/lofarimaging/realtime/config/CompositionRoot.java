package org.lofarimaging.realtime.config;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import org.lofarimaging.realtime.application.history.ObservationHistory;
import org.lofarimaging.realtime.application.pipeline.ObservationService;
import org.lofarimaging.realtime.application.pipeline.ObservationUseCase;
import org.lofarimaging.realtime.application.pipeline.RendererWarmup;
import org.lofarimaging.realtime.application.port.BlockSourceFactory;
import org.lofarimaging.realtime.application.port.ClockPort;
import org.lofarimaging.realtime.application.port.MetricsPort;
import org.lofarimaging.realtime.application.port.RendererPort;
import org.lofarimaging.realtime.application.state.ObservationState;
import org.lofarimaging.realtime.application.status.StatusAggregator;
import org.lofarimaging.realtime.application.status.StatusReporter;
import org.lofarimaging.realtime.infrastructure.descriptor.ObservationDescriptorReader;
import org.lofarimaging.realtime.infrastructure.metrics.NoOpMetricsAdapter;
import org.lofarimaging.realtime.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import org.lofarimaging.realtime.infrastructure.persistence.BlockArtifactWriter;
import org.lofarimaging.realtime.infrastructure.persistence.JsonSessionLogStore;
import org.lofarimaging.realtime.infrastructure.persistence.JsonStatusFileSink;
import org.lofarimaging.realtime.infrastructure.render.DisabledRenderer;
import org.lofarimaging.realtime.infrastructure.render.ExternalProcessRenderer;
import org.lofarimaging.realtime.infrastructure.stream.XstFileTailer;
import org.lofarimaging.realtime.infrastructure.stream.XstSourceLocator;

/**
 * <strong>What:</strong> Wires the observation use case, its control service, the status reporter and the
 * renderer warm-up to concrete adapters.
 * <p><strong>Role:</strong> Composition root of the {@code observe} command; the other commands need only
 * {@link #observationHistory()}.</p>
 * <p><strong>Thread-safety:</strong> Construct and wire on one thread during startup. The shared
 * {@link ObservationState} it hands out is thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot {
  private final ObservationConfig config;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final ObservationState state = new ObservationState();

  /**
   * Creates a composition root with explicit metrics and clock adapters.
   *
   * @param config validated observation configuration
   * @param metrics metrics adapter shared by every component
   * @param clock wall clock for block timestamps and directory names
   */
  public CompositionRoot(ObservationConfig config, MetricsPort metrics, ClockPort clock) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Selects the metrics adapter for a {@code metricsExporter} value.
   *
   * @param exporter {@code otlp} or {@code none}
   * @param stationName station tagged on exported metrics
   * @return OpenTelemetry adapter, or a no-op adapter for {@code none}
   */
  public static MetricsPort metricsFor(String exporter, String stationName) {
    if (exporter != null && exporter.trim().toLowerCase(Locale.ROOT).equals("none")) {
      return new NoOpMetricsAdapter();
    }
    return new OpenTelemetryMetricsAdapter(stationName);
  }

  /** Shared observation state read by the status reporter and written by the pipeline. */
  public ObservationState observationState() {
    return state;
  }

  /** Metrics adapter handed to the pipeline. */
  public MetricsPort metrics() {
    return metrics;
  }

  /** Renderer selected by {@link ObservationConfig#renderer()}. */
  public RendererPort renderer() {
    return switch (config.renderer()) {
      case NONE -> new DisabledRenderer();
      case PROCESS -> new ExternalProcessRenderer(config.rendererCommand(), config.renderTimeout(), null);
    };
  }

  /** Builds the observation use case over the stream, descriptor, archive and renderer adapters. */
  public ObservationUseCase observationUseCase() {
    BlockSourceFactory sources =
        (streamFile, blockSizeBytes) -> new XstFileTailer(streamFile, blockSizeBytes, config.pollInterval(), metrics);
    return new ObservationUseCase(
        state,
        new XstSourceLocator(config.pollInterval()),
        sources,
        new ObservationDescriptorReader(
            config.manualSubbands(), config.minSubband(), config.maxSubband(), config.graceDelay()),
        new BlockArtifactWriter(),
        renderer(),
        new JsonSessionLogStore(),
        metrics,
        clock);
  }

  /** Builds the start/stop service around a fresh use case. */
  public ObservationService observationService() {
    return new ObservationService(state, observationUseCase());
  }

  /** Builds the periodic {@code status.json} publisher. */
  public StatusReporter statusReporter() {
    return new StatusReporter(new StatusAggregator(state), new JsonStatusFileSink(), state, config.statusInterval());
  }

  /**
   * Builds the renderer warm-up when a warm-up file is configured.
   *
   * @return warm-up task, or empty when {@code warmupFile} is unset
   */
  public Optional<RendererWarmup> rendererWarmup() {
    if (config.warmupFile() == null) {
      return Optional.empty();
    }
    return Optional.of(
        new RendererWarmup(
            renderer(),
            config.station(),
            config.warmupFile(),
            config.warmupSubband(),
            config.imagesRoot().resolve("warmup"),
            config.caltableDir()));
  }

  /** Builds the session log reader used by the {@code history} command. */
  public static ObservationHistory observationHistory() {
    return new ObservationHistory(new JsonSessionLogStore());
  }
}
