package org.lofarimaging.realtime.api;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import org.lofarimaging.realtime.application.pipeline.DispatchSummary;
import org.lofarimaging.realtime.application.pipeline.ObservationService;
import org.lofarimaging.realtime.application.port.MetricsPort;
import org.lofarimaging.realtime.application.status.StatusReporter;
import org.lofarimaging.realtime.config.CompositionRoot;
import org.lofarimaging.realtime.config.ObservationConfig;
import org.lofarimaging.realtime.infrastructure.time.SystemClockAdapter;
import org.lofarimaging.realtime.logging.LoggingConfigurator;
import org.lofarimaging.realtime.validation.Numbers;
import org.lofarimaging.realtime.validation.Paths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one observation from CLI key/value arguments until it is interrupted or {@code durationSec} elapses.
 *
 * @since 0.1.0
 */
public final class ObserveCli {
  private static final Logger log = LoggerFactory.getLogger(ObserveCli.class);
  private static final Duration JOIN_SLICE = Duration.ofSeconds(1);
  private static final String SUMMARY_USAGE =
      "usage: observe [input=DIR] [out=DIR] [station=LV614] [rcuMode=1-7] [threads=N] [step=N] "
          + "[heightM=M] [extentM=M] [manualSubbands=true minSubband=N maxSubband=N] "
          + "[renderer=none|process rendererCommand='CMD ARGS'] [config=PATH] [durationSec=N] [--dry-run]";
  private static final String HELP_TEXT = """
      Observe a LOFAR station XST stream

      Usage:
        observe [options]

      Options:
        input=DIR                 Directory the receiver writes *_xst.dat and its descriptor into (default ~/.lofar/xst)
        out=DIR                   Parent of observation directories (default ~/.lofar/images)
        station=NAME              Station name; fixes the block dimension (default LV614)
        rcuMode=1-7               RCU mode passed to the renderer (default 3)
        threads=1-256             Render worker threads (default 4)
        step=N                    Render every N-th block (default 1)
        queueCapacity=N           Render tasks allowed to wait (default threads*4)
        heightM=M / extentM=M     Near-field imaging height and half width (default 1.5 / 50)
        manualSubbands=true       Use minSubband/maxSubband instead of the descriptor
        minSubband=N maxSubband=N Fallback subband range
        caltableDir=DIR           Calibration tables passed to the renderer
        renderer=none|process     Imaging adapter (default none)
        rendererCommand='CMD'     External imaging command when renderer=process
        warmupFile=PATH           Render this recording once before observing
        statusIntervalSec=N       status.json update period (default 5)
        durationSec=N             Stop after N seconds (default 0: run until interrupted)
        config=PATH               YAML file with common/observe sections
        metricsExporter=otlp|none, otelEndpoint=URL, otelResourceAttributes=K=V,...
        --dry-run                 Validate inputs and print the plan
        --verbose                 Enable DEBUG logging
        --help                    Show this message
      """;

  private ObserveCli() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for observe CLI");
    }

    Map<String, String> effective;
    String exporter;
    ObservationConfig config;
    long durationSec;
    try {
      effective = ConfigCliUtils.effectiveConfig("observe", CliArgsParser.toMap(input.keyValueArgs()), log);
      exporter = TelemetryConfigurator.configureMetrics(effective);
      config = ObservationConfig.fromMap(effective);
      String rawDuration = effective.getOrDefault("durationSec", "").trim();
      durationSec = rawDuration.isEmpty()
          ? 0
          : Numbers.requireRange("durationSec", Long.parseLong(rawDuration), 0, 31_536_000);
      Paths.validateWritableDir("input", config.inputDirectory());
      Paths.validateWritableDir("out", config.imagesRoot());
      if (config.caltableDir() != null) {
        Paths.validateReadableDir("caltableDir", config.caltableDir());
      }
    } catch (NumberFormatException ex) {
      log.error("Invalid observe arguments: durationSec must be an integer");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid observe arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration", ex);
      return ExitCode.IO_ERROR;
    }

    if (input.dryRun() || ConfigCliUtils.parseBoolean(effective, "dryRun")) {
      printDryRunPlan(config, exporter, durationSec);
      return ExitCode.SUCCESS;
    }

    MetricsPort metrics = CompositionRoot.metricsFor(exporter, config.stationName());
    CompositionRoot root = new CompositionRoot(config, metrics, new SystemClockAdapter());
    ObservationService service = root.observationService();
    Thread shutdownHook = new Thread(() -> stopOnShutdown(service), "observe-shutdown");
    try (StatusReporter reporter = root.statusReporter()) {
      root.rendererWarmup().ifPresent(warmup -> warmup.start());
      Runtime.getRuntime().addShutdownHook(shutdownHook);
      reporter.start();
      service.start(config.toSettings());
      log.info("Observing {} (station {}, threads={}, step={})",
          config.inputDirectory(), config.stationName(), config.threads(), config.step());
      awaitObservation(service, durationSec);
      reporter.publishOnce();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      service.stop();
      log.error("Observe command interrupted; stopping observation");
      return ExitCode.INTERRUPTED;
    } finally {
      removeHook(shutdownHook);
      closeMetrics(metrics);
    }

    service.lastSummary().ifPresent(ObserveCli::logSummary);
    Optional<Exception> failure = service.lastFailure();
    if (failure.isEmpty()) {
      return ExitCode.SUCCESS;
    }
    Exception ex = failure.get();
    ExitCode exit = ExitCode.forObservationFailure(ex);
    switch (exit) {
      case CONFIG_ERROR -> log.error("Observation setup failed: {}", ex.getMessage());
      case IO_ERROR -> log.error("Observation I/O failure: {}", ex.getMessage());
      default -> log.error("Observation failed: {}", ex.getMessage());
    }
    return exit;
  }

  private static void awaitObservation(ObservationService service, long durationSec) throws InterruptedException {
    long deadline = durationSec == 0 ? Long.MAX_VALUE : System.nanoTime() + Duration.ofSeconds(durationSec).toNanos();
    while (!service.awaitCompletion(JOIN_SLICE)) {
      if (System.nanoTime() - deadline >= 0) {
        log.info("Observation duration of {} s reached; stopping", durationSec);
        service.stop();
        deadline = Long.MAX_VALUE;
      }
    }
  }

  private static void stopOnShutdown(ObservationService service) {
    if (service.stop()) {
      try {
        service.awaitCompletion(Duration.ofSeconds(30));
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        log.warn("Interrupted while waiting for observation shutdown");
      }
    }
  }

  private static void removeHook(Thread hook) {
    try {
      Runtime.getRuntime().removeShutdownHook(hook);
    } catch (IllegalStateException ex) {
      log.debug("JVM shutdown in progress; shutdown hook stays registered");
    }
  }

  private static void closeMetrics(MetricsPort metrics) {
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception ex) {
        log.warn("Failed to close metrics adapter", ex);
      }
    }
  }

  private static void logSummary(DispatchSummary summary) {
    log.info("Observation complete: {} blocks offered, {} rendered, {} failed, {} cancelled",
        summary.offered(), summary.completed(), summary.failed(), summary.cancelled());
  }

  private static void printDryRunPlan(ObservationConfig config, String exporter, long durationSec) {
    Path caltable = config.caltableDir();
    Map<String, Object> plan = CliPrinter.rows();
    plan.put("Input directory", config.inputDirectory());
    plan.put("Images root", config.imagesRoot());
    plan.put("Station", config.stationName() + " (dimension " + config.station().dimension() + ")");
    plan.put("RCU mode", config.rcuMode());
    plan.put("Threads / step", config.threads() + " / " + config.step());
    plan.put("Queue capacity", config.queueCapacity());
    plan.put("Height / extent", config.heightMetres() + " m / " + config.extentMetres() + " m");
    plan.put("Subbands", describeSubbands(config));
    plan.put("Caltable dir", caltable == null ? "<none>" : caltable);
    plan.put("Renderer",
        config.renderer() + (config.rendererCommand().isEmpty() ? "" : " " + config.rendererCommand()));
    plan.put("Duration", durationSec == 0 ? "until interrupted" : durationSec + " s");
    plan.put("Metrics exporter", exporter);
    CliPrinter.printSection(
        "Observe dry-run: no stream will be read.", plan, " Re-run without --dry-run to start observing.");
  }

  private static String describeSubbands(ObservationConfig config) {
    String bounds = config.minSubband() == null || config.maxSubband() == null
        ? "<none>"
        : config.minSubband() + ":" + config.maxSubband();
    return config.manualSubbands() ? "manual " + bounds : "descriptor, fallback " + bounds;
  }
}
