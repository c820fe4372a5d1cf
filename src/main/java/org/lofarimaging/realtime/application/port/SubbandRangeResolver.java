package org.lofarimaging.realtime.application.port;

import java.io.IOException;
import java.nio.file.Path;
import org.lofarimaging.realtime.domain.block.SubbandRange;

/**
 * Port resolving the subband range the station is cycling through for the stream in a directory.
 *
 * @since 0.1.0
 */
public interface SubbandRangeResolver {
  /**
   * Resolves the range.
   *
   * @param inputDirectory directory holding the stream file and its descriptor
   * @return resolved range
   * @throws IOException if the descriptor exists but cannot be read
   * @throws InterruptedException if interrupted while waiting for the descriptor
   * @throws org.lofarimaging.realtime.application.pipeline.ObservationSetupException if no range can be found
   */
  SubbandRange resolve(Path inputDirectory) throws IOException, InterruptedException;
}
