package org.lofarimaging.realtime.application.port;

import java.nio.file.Path;

/**
 * Creates a {@link BlockSource} over a located stream file.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface BlockSourceFactory {
  /**
   * Creates an unopened source; the caller invokes {@link BlockSource#start()}.
   *
   * @param streamFile stream file to tail
   * @param blockSizeBytes size of one block in bytes
   * @return unopened source
   */
  BlockSource create(Path streamFile, int blockSizeBytes);
}
