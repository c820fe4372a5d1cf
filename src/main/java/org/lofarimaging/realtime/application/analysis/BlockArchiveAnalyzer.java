package org.lofarimaging.realtime.application.analysis;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.TreeMap;
import java.util.stream.Stream;
import org.lofarimaging.realtime.domain.block.BlockArtifactNames;
import org.lofarimaging.realtime.domain.block.BlockSidecar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads an archived {@code blocks/} directory back and summarises which subbands were captured and when.
 *
 * <p>Data files and sidecars are paired in sorted name order. A differing count is an error; pairs whose
 * timestamps disagree are reported as a warning and kept.</p>
 *
 * @since 0.1.0
 */
public final class BlockArchiveAnalyzer {
  private static final Logger log = LoggerFactory.getLogger(BlockArchiveAnalyzer.class);

  /**
   * Analyzes a directory.
   *
   * @param directory directory holding {@code *_xst.dat} and {@code *_xst.h} pairs
   * @return summary
   * @throws IOException if the directory cannot be read, the counts differ, or an artifact is malformed
   */
  public ArchiveSummary analyze(Path directory) throws IOException {
    Objects.requireNonNull(directory, "directory");
    List<Path> dataFiles = list(directory, BlockArtifactNames.DATA_SUFFIX);
    List<Path> sidecars = list(directory, BlockArtifactNames.SIDECAR_SUFFIX);
    if (dataFiles.size() != sidecars.size()) {
      throw new IOException(
          "Mismatch in number of data files (" + dataFiles.size() + ") and sidecars (" + sidecars.size()
              + ") in " + directory);
    }

    List<ArchivedBlock> blocks = new ArrayList<>(dataFiles.size());
    for (int i = 0; i < dataFiles.size(); i++) {
      Path dataFile = dataFiles.get(i);
      Path sidecar = sidecars.get(i);
      Instant timestamp = timestampOf(dataFile);
      Instant sidecarTimestamp = timestampOf(sidecar);
      if (!timestamp.equals(sidecarTimestamp)) {
        log.warn("Timestamps do not match for {} and {}", dataFile.getFileName(), sidecar.getFileName());
      }
      blocks.add(new ArchivedBlock(timestamp, subbandOf(sidecar), dataFile, sidecar));
    }
    blocks.sort(Comparator.comparing(ArchivedBlock::timestamp).thenComparingInt(ArchivedBlock::subband));
    return summarize(blocks);
  }

  static ArchiveSummary summarize(List<ArchivedBlock> blocks) {
    if (blocks.isEmpty()) {
      return new ArchiveSummary(0, null, null, 0, null, null, 0d, null, blocks);
    }
    TreeMap<Integer, Integer> perSubband = new TreeMap<>();
    Instant start = blocks.get(0).timestamp();
    Instant end = start;
    for (ArchivedBlock block : blocks) {
      perSubband.merge(block.subband(), 1, Integer::sum);
      if (block.timestamp().isBefore(start)) {
        start = block.timestamp();
      }
      if (block.timestamp().isAfter(end)) {
        end = block.timestamp();
      }
    }
    int first = perSubband.firstKey();
    int last = perSubband.lastKey();
    double averagePerSubband = round2((double) blocks.size() / perSubband.size());
    Double duration = null;
    if (blocks.size() > 1) {
      double spanSeconds = Duration.between(start, end).toMillis() / 1000d;
      duration = round2(spanSeconds / blocks.size());
    }
    return new ArchiveSummary(
        blocks.size(), first, last, perSubband.size(), start, end, averagePerSubband, duration, blocks);
  }

  private static List<Path> list(Path directory, String suffix) throws IOException {
    try (Stream<Path> files = Files.list(directory)) {
      return files
          .filter(Files::isRegularFile)
          .filter(path -> path.getFileName().toString().endsWith(suffix))
          .sorted()
          .toList();
    }
  }

  private static Instant timestampOf(Path file) throws IOException {
    return BlockArtifactNames.parseTimestamp(file.getFileName().toString())
        .orElseThrow(() -> new IOException("Cannot read timestamp from file name " + file.getFileName()));
  }

  private static int subbandOf(Path sidecar) throws IOException {
    String content = Files.readString(sidecar, StandardCharsets.UTF_8);
    OptionalInt subband;
    try {
      subband = BlockSidecar.parseSubband(content);
    } catch (NumberFormatException ex) {
      throw new IOException("Invalid subband in " + sidecar, ex);
    }
    if (subband.isEmpty()) {
      throw new IOException("No --xcsubband entry in " + sidecar);
    }
    return subband.getAsInt();
  }

  private static double round2(double value) {
    return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_EVEN).doubleValue();
  }
}
