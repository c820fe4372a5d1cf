package org.lofarimaging.realtime.api;

import java.util.Optional;
import org.lofarimaging.realtime.logging.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command dispatcher for the real-time XST pipeline.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE =
      "usage: lofar-realtime <observe|history|analyze|simulate> [options]";
  private static final String HELP_TEXT = """
      LOFAR real-time XST pipeline

      Usage:
        lofar-realtime <command> [options]

      Commands:
        observe    Tail a station XST stream, archive blocks and dispatch renders
        history    List the latest image log entries of past observations
        analyze    Summarise an archived blocks/ directory
        simulate   Replay a recorded XST file into a growing stream file

      Global flags:
        --help      Show this message (or <command> --help for details)
        --verbose   Enable DEBUG logging
      """;

  private Main() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Dispatches a subcommand and returns its exit code without terminating the JVM.
   *
   * @param args dispatcher arguments (first non-flag token is the subcommand)
   * @return exit code reported by the delegated command
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    Optional<String> command = input.command();
    if (command.isEmpty()) {
      if (input.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    }

    String[] delegateArgs = input.subcommandArgs();
    return switch (command.get()) {
      case "observe" -> ObserveCli.run(delegateArgs);
      case "history" -> HistoryCli.run(delegateArgs);
      case "analyze" -> AnalyzeCli.run(delegateArgs);
      case "simulate" -> SimulateCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command.get());
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }
}
