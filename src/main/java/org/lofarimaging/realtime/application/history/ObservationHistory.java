package org.lofarimaging.realtime.application.history;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.stream.Stream;
import org.lofarimaging.realtime.application.port.SessionLogPort;
import org.lofarimaging.realtime.domain.observation.ObservationSession;
import org.lofarimaging.realtime.domain.status.ImageLogEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reloads the image logs of past observations from their {@code session_log.json} files.
 *
 * @since 0.1.0
 */
public final class ObservationHistory {
  private static final Logger log = LoggerFactory.getLogger(ObservationHistory.class);

  private static final Comparator<ImageLogEntry> NEWEST_FIRST =
      Comparator.comparing(ImageLogEntry::timestamp).reversed();

  private final SessionLogPort sessionLog;

  public ObservationHistory(SessionLogPort sessionLog) {
    this.sessionLog = Objects.requireNonNull(sessionLog, "sessionLog");
  }

  /**
   * Loads every observation under {@code imagesRoot} that has a readable session log. Unreadable logs are
   * skipped with a warning.
   *
   * @param imagesRoot parent directory of the observation directories
   * @return entries keyed by observation directory name, in name order
   * @throws IOException if {@code imagesRoot} cannot be listed
   */
  public Map<String, List<ImageLogEntry>> loadAll(Path imagesRoot) throws IOException {
    Objects.requireNonNull(imagesRoot, "imagesRoot");
    Map<String, List<ImageLogEntry>> result = new TreeMap<>();
    if (!Files.isDirectory(imagesRoot)) {
      log.warn("Images root {} does not exist", imagesRoot);
      return result;
    }
    List<Path> observations;
    try (Stream<Path> children = Files.list(imagesRoot)) {
      observations = children.filter(Files::isDirectory).sorted().toList();
    }
    for (Path observation : observations) {
      Path logFile = observation.resolve(ObservationSession.SESSION_LOG_FILE);
      if (!Files.isRegularFile(logFile)) {
        continue;
      }
      try {
        result.put(observation.getFileName().toString(), sessionLog.load(logFile));
      } catch (IOException | RuntimeException ex) {
        log.warn("Skipping unreadable session log {}: {}", logFile, ex.getMessage());
      }
    }
    return result;
  }

  /**
   * Returns the {@code n} most recent entries across all observations, newest first.
   *
   * @param byObservation entries as returned by {@link #loadAll(Path)}
   * @param n maximum number of entries; must be non-negative
   * @return newest entries
   */
  public static List<ImageLogEntry> latest(Map<String, List<ImageLogEntry>> byObservation, int n) {
    Objects.requireNonNull(byObservation, "byObservation");
    List<ImageLogEntry> all = new ArrayList<>();
    byObservation.values().forEach(all::addAll);
    return latest(all, n);
  }

  /**
   * Returns the {@code n} most recent entries, newest first.
   *
   * @param entries entries in any order
   * @param n maximum number of entries; must be non-negative
   * @return newest entries
   */
  public static List<ImageLogEntry> latest(List<ImageLogEntry> entries, int n) {
    Objects.requireNonNull(entries, "entries");
    if (n < 0) {
      throw new IllegalArgumentException("n must be non-negative");
    }
    return entries.stream().sorted(NEWEST_FIRST).limit(n).toList();
  }
}
