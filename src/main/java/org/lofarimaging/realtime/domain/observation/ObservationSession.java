package org.lofarimaging.realtime.domain.observation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * <strong>What:</strong> Directory layout of one observation: a UTC-stamped root holding {@code blocks/},
 * {@code images/} and {@code movies/}.
 * <p><strong>Role:</strong> Domain value created once per observation and shared by the archive, the renderer
 * and the session log.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param root observation root directory, named {@code yyyyMMdd_HHmmss}
 * @param createdAt instant the session was created
 * @since 0.1.0
 */
public record ObservationSession(Path root, Instant createdAt) {
  /** Name of the session log written into the root at shutdown. */
  public static final String SESSION_LOG_FILE = "session_log.json";
  /** Name of the periodically refreshed status document. */
  public static final String STATUS_FILE = "status.json";

  private static final DateTimeFormatter NAME = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

  public ObservationSession {
    Objects.requireNonNull(root, "root");
    Objects.requireNonNull(createdAt, "createdAt");
  }

  /**
   * Creates the session directories under {@code imagesRoot}. Existing directories are reused.
   *
   * @param imagesRoot parent directory for all observations
   * @param createdAt creation instant; names the root directory in UTC
   * @return the created session
   * @throws IOException if a directory cannot be created
   */
  public static ObservationSession create(Path imagesRoot, Instant createdAt) throws IOException {
    Objects.requireNonNull(imagesRoot, "imagesRoot");
    ObservationSession session = new ObservationSession(imagesRoot.resolve(directoryName(createdAt)), createdAt);
    Files.createDirectories(session.blocks());
    Files.createDirectories(session.images());
    Files.createDirectories(session.movies());
    return session;
  }

  /**
   * Formats the root directory name for an instant.
   *
   * @param createdAt creation instant
   * @return name such as {@code 20240301_101500}
   */
  public static String directoryName(Instant createdAt) {
    return NAME.format(LocalDateTime.ofInstant(createdAt, ZoneOffset.UTC));
  }

  public String name() {
    return root.getFileName().toString();
  }

  public Path blocks() {
    return root.resolve("blocks");
  }

  public Path images() {
    return root.resolve("images");
  }

  public Path movies() {
    return root.resolve("movies");
  }

  public Path sessionLog() {
    return root.resolve(SESSION_LOG_FILE);
  }

  public Path statusFile() {
    return root.resolve(STATUS_FILE);
  }

  /**
   * Returns the path of an image relative to the images root, {@code <observation>/images/<file>}.
   *
   * @param image image path produced by the renderer
   * @return relative path string using {@code /} separators
   */
  public String relativeImagePath(Path image) {
    Objects.requireNonNull(image, "image");
    return name() + "/images/" + image.getFileName();
  }
}
