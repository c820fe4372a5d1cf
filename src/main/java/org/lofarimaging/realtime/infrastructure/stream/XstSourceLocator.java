package org.lofarimaging.realtime.infrastructure.stream;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;
import org.lofarimaging.realtime.application.port.StreamSourceLocator;
import org.lofarimaging.realtime.domain.block.BlockArtifactNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Polls a directory until a regular file ending in {@code _xst.dat} appears. When several match, the
 * lexicographically first is used. There is no timeout; interruption ends the wait.
 *
 * @since 0.1.0
 */
public final class XstSourceLocator implements StreamSourceLocator {
  private static final Logger log = LoggerFactory.getLogger(XstSourceLocator.class);

  private final Duration pollInterval;

  public XstSourceLocator(Duration pollInterval) {
    this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
    if (pollInterval.isNegative() || pollInterval.isZero()) {
      throw new IllegalArgumentException("pollInterval must be positive");
    }
  }

  @Override
  public Path awaitSource(Path directory) throws IOException, InterruptedException {
    Objects.requireNonNull(directory, "directory");
    long attempts = 0;
    while (true) {
      if (Thread.currentThread().isInterrupted()) {
        throw new InterruptedException("Interrupted while waiting for XST stream in " + directory);
      }
      Optional<Path> found = find(directory);
      if (found.isPresent()) {
        log.debug("Located stream {} after {} polls", found.get(), attempts);
        return found.get();
      }
      if (attempts == 0) {
        log.info("No *{} file in {} yet; polling every {} ms", BlockArtifactNames.DATA_SUFFIX, directory,
            pollInterval.toMillis());
      }
      attempts++;
      Thread.sleep(pollInterval.toMillis());
    }
  }

  /**
   * Looks for a stream file once.
   *
   * @param directory directory to scan; a missing directory counts as empty
   * @return first matching file in name order
   * @throws IOException if the directory exists but cannot be listed
   */
  public static Optional<Path> find(Path directory) throws IOException {
    if (!Files.isDirectory(directory)) {
      return Optional.empty();
    }
    try (Stream<Path> files = Files.list(directory)) {
      return files
          .filter(Files::isRegularFile)
          .filter(path -> path.getFileName().toString().endsWith(BlockArtifactNames.DATA_SUFFIX))
          .sorted()
          .findFirst();
    }
  }
}
