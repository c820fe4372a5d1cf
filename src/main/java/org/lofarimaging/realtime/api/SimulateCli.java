package org.lofarimaging.realtime.api;

import java.io.IOException;
import java.nio.file.Files;
import java.util.Map;
import org.lofarimaging.realtime.application.simulate.StreamSimulator;
import org.lofarimaging.realtime.config.SimulateConfig;
import org.lofarimaging.realtime.logging.LoggingConfigurator;
import org.lofarimaging.realtime.validation.Paths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replays a recorded XST file into a growing stream file, one block per interval.
 *
 * @since 0.1.0
 */
public final class SimulateCli {
  private static final Logger log = LoggerFactory.getLogger(SimulateCli.class);
  private static final String SUMMARY_USAGE =
      "usage: simulate source=FILE target=DIR/NAME_xst.dat [station=LV614] [minSubband=N] [maxSubband=N] "
          + "[intervalMillis=N]";
  private static final String HELP_TEXT = """
      Simulate a station XST stream

      Usage:
        simulate source=FILE target=FILE [options]

      Required:
        source=FILE          Recorded XST file
        target=FILE          Stream file to write; name must end in _xst.dat

      Optional:
        station=NAME         Station of the recording; fixes the block size (default LV614)
        minSubband=N         Lower subband written to metadata.h (default 100)
        maxSubband=N         Upper subband written to metadata.h (default minSubband)
        intervalMillis=N     Pause after each block (default 1000)
        config=PATH          YAML file with common/simulate sections
      """;

  private SimulateCli() {}

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    SimulateConfig config;
    try {
      Map<String, String> effective =
          ConfigCliUtils.effectiveConfig("simulate", CliArgsParser.toMap(input.keyValueArgs()), log);
      config = SimulateConfig.fromMap(effective);
      if (!Files.isRegularFile(config.source())) {
        throw new IllegalArgumentException("source is not a readable file: " + config.source());
      }
      Paths.validateWritableDir("target directory", config.target().getParent());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid simulate arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration", ex);
      return ExitCode.IO_ERROR;
    }

    try {
      long written = new StreamSimulator()
          .simulate(config.source(), config.target(), config.blockSizeBytes(), config.range(), config.interval());
      CliPrinter.println("Wrote " + written + " block(s) to " + config.target());
      if (Thread.currentThread().isInterrupted()) {
        return ExitCode.INTERRUPTED;
      }
      return ExitCode.SUCCESS;
    } catch (IOException ex) {
      log.error("Simulation failed writing {}", config.target(), ex);
      return ExitCode.IO_ERROR;
    }
  }
}
