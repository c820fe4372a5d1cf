package org.lofarimaging.realtime.api;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import org.lofarimaging.realtime.application.analysis.ArchiveSummary;
import org.lofarimaging.realtime.application.analysis.BlockArchiveAnalyzer;
import org.lofarimaging.realtime.logging.LoggingConfigurator;
import org.lofarimaging.realtime.validation.Paths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Summarises a {@code blocks/} directory written by an observation.
 *
 * @since 0.1.0
 */
public final class AnalyzeCli {
  private static final Logger log = LoggerFactory.getLogger(AnalyzeCli.class);
  private static final String SUMMARY_USAGE = "usage: analyze in=DIR";
  private static final String HELP_TEXT = """
      Summarise archived XST blocks

      Usage:
        analyze in=DIR

      Required:
        in=DIR   Directory holding *_xst.dat / *_xst.h pairs, e.g. <observation>/blocks
      """;

  private AnalyzeCli() {}

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    Path directory;
    try {
      Map<String, String> effective =
          ConfigCliUtils.effectiveConfig("analyze", CliArgsParser.toMap(input.keyValueArgs()), log);
      String raw = effective.get("in");
      if (raw == null || raw.isBlank()) {
        throw new IllegalArgumentException("in is required");
      }
      directory = Paths.validateReadableDir("in", Path.of(raw.trim()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid analyze arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration", ex);
      return ExitCode.IO_ERROR;
    }

    try {
      ArchiveSummary summary = new BlockArchiveAnalyzer().analyze(directory);
      CliPrinter.printLines(summary.describe());
      return ExitCode.SUCCESS;
    } catch (IOException ex) {
      log.error("Unable to analyse {}: {}", directory, ex.getMessage());
      return ExitCode.IO_ERROR;
    }
  }
}
