package org.lofarimaging.realtime.api;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.lofarimaging.realtime.application.history.ObservationHistory;
import org.lofarimaging.realtime.config.CompositionRoot;
import org.lofarimaging.realtime.domain.status.ImageLogEntry;
import org.lofarimaging.realtime.logging.LoggingConfigurator;
import org.lofarimaging.realtime.validation.Numbers;
import org.lofarimaging.realtime.validation.Paths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prints the newest image log entries across every observation under an images root.
 *
 * @since 0.1.0
 */
public final class HistoryCli {
  private static final Logger log = LoggerFactory.getLogger(HistoryCli.class);
  private static final String SUMMARY_USAGE = "usage: history [out=DIR] [limit=1-10000] [config=PATH]";
  private static final String HELP_TEXT = """
      List recent images of past observations

      Usage:
        history [out=DIR] [limit=N]

      Options:
        out=DIR       Images root holding observation directories (default ~/.lofar/images)
        limit=N       Number of entries to print, newest first (default 20)
        config=PATH   YAML file with common/history sections
      """;

  private HistoryCli() {}

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    Path imagesRoot;
    int limit;
    try {
      Map<String, String> effective =
          ConfigCliUtils.effectiveConfig("history", CliArgsParser.toMap(input.keyValueArgs()), log);
      imagesRoot = Paths.validateReadableDir("out", Path.of(effective.get("out").trim()));
      limit = (int) Numbers.requireRange("limit", Long.parseLong(effective.get("limit").trim()), 1, 10_000);
    } catch (NumberFormatException ex) {
      log.error("Invalid history arguments: limit must be an integer");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid history arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration", ex);
      return ExitCode.IO_ERROR;
    }

    try {
      ObservationHistory history = CompositionRoot.observationHistory();
      Map<String, List<ImageLogEntry>> byObservation = history.loadAll(imagesRoot);
      List<ImageLogEntry> latest = ObservationHistory.latest(byObservation, limit);
      CliPrinter.println(byObservation.size() + " observation(s) under " + imagesRoot);
      for (ImageLogEntry entry : latest) {
        CliPrinter.println(format(entry));
      }
      return ExitCode.SUCCESS;
    } catch (IOException ex) {
      log.error("Unable to read observations under {}", imagesRoot, ex);
      return ExitCode.IO_ERROR;
    }
  }

  static String format(ImageLogEntry entry) {
    String duration = entry.durationSeconds() == null ? "-" : String.format(Locale.ROOT, "%.2fs", entry.durationSeconds());
    return entry.timestamp() + "  sb " + entry.subband() + "  " + duration + "  " + entry.filename();
  }
}
