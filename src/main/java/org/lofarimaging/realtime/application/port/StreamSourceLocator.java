package org.lofarimaging.realtime.application.port;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Port that waits for the station to start writing its XST stream file.
 *
 * @since 0.1.0
 */
public interface StreamSourceLocator {
  /**
   * Blocks until a stream file appears in {@code directory}.
   *
   * @param directory directory the receiver writes into
   * @return path of the stream file
   * @throws IOException if the directory cannot be listed
   * @throws InterruptedException if the wait is interrupted, which is how a stop is delivered
   */
  Path awaitSource(Path directory) throws IOException, InterruptedException;
}
