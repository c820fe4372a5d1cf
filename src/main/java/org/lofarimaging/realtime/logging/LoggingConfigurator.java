package org.lofarimaging.realtime.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * Runtime log level switches for the command-line tools.
 *
 * <p>{@code --verbose} turns on DEBUG for the pipeline's own loggers only, so per-block archive and render
 * lines show up without the OpenTelemetry exporter and other libraries flooding the console.</p>
 *
 * @since 0.1.0
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  /** Parent logger of every pipeline class. */
  public static final String PIPELINE_LOGGER = "org.lofarimaging.realtime";

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Sets the pipeline loggers to DEBUG.
   *
   * @return {@code true} if the level was changed, {@code false} if it already was DEBUG or the SLF4J backend is
   *     not Logback
   */
  public static boolean enableVerboseLogging() {
    return setPipelineLevel(Level.DEBUG);
  }

  /**
   * Clears an explicit pipeline level so the loggers inherit from {@code logback.xml} again.
   *
   * @return {@code true} if a level was cleared
   */
  public static boolean resetPipelineLevel() {
    return setPipelineLevel(null);
  }

  private static boolean setPipelineLevel(Level level) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext context)) {
      log.warn("Cannot change log levels: SLF4J is bound to {}", factory.getClass().getName());
      return false;
    }
    Logger pipeline = context.getLogger(PIPELINE_LOGGER);
    Level previous = pipeline.getLevel();
    if (previous == level) {
      return false;
    }
    pipeline.setLevel(level);
    log.debug("Pipeline log level changed from {} to {}", previous, level);
    return true;
  }
}
