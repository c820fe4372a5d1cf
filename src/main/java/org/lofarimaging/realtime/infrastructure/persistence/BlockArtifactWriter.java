package org.lofarimaging.realtime.infrastructure.persistence;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.lofarimaging.realtime.application.port.BlockArchivePort;
import org.lofarimaging.realtime.domain.block.BlockArtifactNames;
import org.lofarimaging.realtime.domain.block.BlockSidecar;
import org.lofarimaging.realtime.domain.block.SubbandRange;
import org.lofarimaging.realtime.domain.block.XstBlock;

/**
 * {@link BlockArchivePort} writing {@code <yyyyMMdd_HHmmss>_xst.dat} with the raw block bytes and
 * {@code <yyyyMMdd_HHmmss>_xst.h} with the subband sidecar.
 *
 * <p>Names have one-second resolution, so two blocks stamped within the same second overwrite each other.</p>
 *
 * @since 0.1.0
 */
public final class BlockArtifactWriter implements BlockArchivePort {
  @Override
  public Path persist(XstBlock block, SubbandRange range, Path outputDir) throws IOException {
    Objects.requireNonNull(block, "block");
    Objects.requireNonNull(range, "range");
    Objects.requireNonNull(outputDir, "outputDir");
    Files.createDirectories(outputDir);
    Path dataFile = outputDir.resolve(BlockArtifactNames.dataFileName(block.timestamp()));
    Path sidecar = outputDir.resolve(BlockArtifactNames.sidecarFileName(block.timestamp()));
    Files.write(dataFile, block.data());
    Files.writeString(sidecar, BlockSidecar.render(range, block.subband()), StandardCharsets.UTF_8);
    return dataFile;
  }
}
