package org.lofarimaging.realtime.application.analysis;

import java.nio.file.Path;
import java.time.Instant;

/**
 * One archived artifact pair read back from a {@code blocks/} directory.
 *
 * @param timestamp timestamp encoded in the data file name
 * @param subband subband recorded in the sidecar
 * @param dataFile raw sample file
 * @param sidecarFile subband sidecar
 * @since 0.1.0
 */
public record ArchivedBlock(Instant timestamp, int subband, Path dataFile, Path sidecarFile) {}
