package org.lofarimaging.realtime.application.port;

import java.io.IOException;
import java.nio.file.Path;
import org.lofarimaging.realtime.domain.block.SubbandRange;
import org.lofarimaging.realtime.domain.block.XstBlock;

/**
 * <strong>What:</strong> Port persisting every framed block as a raw data file plus a subband sidecar.
 * <p><strong>Why:</strong> The archive lets an observation be re-imaged later with full subband metadata,
 * independently of decimation.</p>
 * <p><strong>Role:</strong> Implemented by {@code BlockArtifactWriter}; invoked by the observation loop before
 * dispatch.</p>
 * <p><strong>Thread-safety:</strong> Called from the single producer thread.</p>
 *
 * @since 0.1.0
 */
public interface BlockArchivePort {
  /**
   * Writes the artifact pair for {@code block} into {@code outputDir}.
   *
   * @param block block to archive
   * @param range subband range of the observation, recorded in the sidecar
   * @param outputDir target directory, usually the observation's {@code blocks/}
   * @return path of the written data file
   * @throws IOException if either file cannot be written
   */
  Path persist(XstBlock block, SubbandRange range, Path outputDir) throws IOException;
}
