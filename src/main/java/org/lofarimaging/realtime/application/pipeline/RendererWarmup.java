package org.lofarimaging.realtime.application.pipeline;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;
import org.lofarimaging.realtime.application.port.RenderRequest;
import org.lofarimaging.realtime.application.port.RendererPort;
import org.lofarimaging.realtime.domain.block.XstBlock;
import org.lofarimaging.realtime.domain.station.StationGeometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders one recorded block in the background so the imager's caches are warm before observing starts.
 * A failure is only logged.
 *
 * @since 0.1.0
 */
public final class RendererWarmup {
  private static final Logger log = LoggerFactory.getLogger(RendererWarmup.class);

  private final RendererPort renderer;
  private final StationGeometry station;
  private final Path warmupFile;
  private final int subband;
  private final Path outputDir;
  private final Path caltableDir;

  /**
   * Creates the warm-up task.
   *
   * @param renderer external imager
   * @param station station geometry
   * @param warmupFile recorded XST file; only its first block is rendered
   * @param subband subband the recording was taken at
   * @param outputDir scratch directory for warm-up images
   * @param caltableDir calibration tables, or {@code null}
   */
  public RendererWarmup(
      RendererPort renderer, StationGeometry station, Path warmupFile, int subband, Path outputDir, Path caltableDir) {
    this.renderer = Objects.requireNonNull(renderer, "renderer");
    this.station = Objects.requireNonNull(station, "station");
    this.warmupFile = Objects.requireNonNull(warmupFile, "warmupFile");
    this.subband = subband;
    this.outputDir = Objects.requireNonNull(outputDir, "outputDir");
    this.caltableDir = caltableDir;
  }

  /**
   * Starts the warm-up on a daemon thread.
   *
   * @return the started thread
   */
  public Thread start() {
    Thread thread = new Thread(this::runOnce, "renderer-warmup");
    thread.setDaemon(true);
    thread.start();
    return thread;
  }

  /**
   * Renders the warm-up block on the calling thread.
   *
   * @return {@code true} if the render succeeded
   */
  public boolean runOnce() {
    long startNanos = System.nanoTime();
    try {
      XstBlock block = readFirstBlock();
      Files.createDirectories(outputDir);
      renderer.render(new RenderRequest(block, station, outputDir, caltableDir));
      long millis = (System.nanoTime() - startNanos) / 1_000_000L;
      log.info("Renderer warm-up finished in {} ms", millis);
      return true;
    } catch (Exception ex) {
      log.warn("Renderer warm-up with {} failed", warmupFile, ex);
      return false;
    }
  }

  private XstBlock readFirstBlock() throws IOException {
    int blockSize = XstBlock.sizeInBytes(station.dimension());
    byte[] data = new byte[blockSize];
    try (var in = Files.newInputStream(warmupFile)) {
      int read = in.readNBytes(data, 0, blockSize);
      if (read < blockSize) {
        throw new IOException(
            "Warm-up file " + warmupFile + " holds " + read + " bytes; one block needs " + blockSize);
      }
    }
    return new XstBlock(0, Instant.now(), subband, station.dimension(), data);
  }
}
