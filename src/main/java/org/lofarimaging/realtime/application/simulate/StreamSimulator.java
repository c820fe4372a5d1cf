package org.lofarimaging.realtime.application.simulate;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.Objects;
import org.lofarimaging.realtime.domain.block.SubbandRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Copies a recorded XST file block by block into a growing target file at a fixed pace, after writing a
 * {@code metadata.h} descriptor next to the target.
 *
 * <p>Each block is flushed before the pause so a tailer sees whole blocks appear one at a time. An incomplete
 * trailing block in the recording is dropped. Interruption stops the replay after the current block.</p>
 *
 * @since 0.1.0
 */
public final class StreamSimulator {
  private static final Logger log = LoggerFactory.getLogger(StreamSimulator.class);

  /** Descriptor file written next to the target. */
  public static final String DESCRIPTOR_FILE = "metadata.h";

  /**
   * Replays {@code source} into {@code target}.
   *
   * @param source recorded XST file
   * @param target stream file to create or truncate; its name should end in {@code _xst.dat}
   * @param blockSizeBytes size of one block
   * @param range subband range written to the descriptor
   * @param interval pause after each block
   * @return number of blocks written
   * @throws IOException if reading or writing fails
   */
  public long simulate(Path source, Path target, int blockSizeBytes, SubbandRange range, Duration interval)
      throws IOException {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(target, "target");
    Objects.requireNonNull(range, "range");
    Objects.requireNonNull(interval, "interval");
    if (blockSizeBytes <= 0) {
      throw new IllegalArgumentException("blockSizeBytes must be positive");
    }
    Path directory = target.toAbsolutePath().getParent();
    Files.createDirectories(directory);
    Path descriptor = directory.resolve(DESCRIPTOR_FILE);
    Files.writeString(descriptor, "subbands=" + range.min() + ":" + range.max() + "\n", StandardCharsets.UTF_8);
    log.info("Descriptor written to {}", descriptor);

    long totalBlocks = Files.size(source) / blockSizeBytes;
    log.info(
        "Simulating {} blocks of {} bytes from {} to {} every {} ms",
        totalBlocks,
        blockSizeBytes,
        source,
        target,
        interval.toMillis());

    byte[] block = new byte[blockSizeBytes];
    long written = 0;
    try (InputStream in = Files.newInputStream(source);
        OutputStream out =
            Files.newOutputStream(
                target,
                StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING,
                StandardOpenOption.WRITE)) {
      while (true) {
        int read = in.readNBytes(block, 0, blockSizeBytes);
        if (read < blockSizeBytes) {
          log.info("End of recording{}", read > 0 ? " (dropped incomplete block of " + read + " bytes)" : "");
          break;
        }
        out.write(block);
        out.flush();
        written++;
        log.debug("[{}/{}] Block written", written, totalBlocks);
        if (!pause(interval)) {
          log.info("Simulation interrupted after {} blocks", written);
          break;
        }
      }
    }
    log.info("Simulation complete: {} blocks written to {}", written, target);
    return written;
  }

  private static boolean pause(Duration interval) {
    if (interval.isZero() || interval.isNegative()) {
      return !Thread.currentThread().isInterrupted();
    }
    try {
      Thread.sleep(interval.toMillis());
      return true;
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      return false;
    }
  }
}
