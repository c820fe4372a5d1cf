package org.lofarimaging.realtime.infrastructure.render;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.lofarimaging.realtime.application.port.RenderRequest;
import org.lofarimaging.realtime.application.port.RenderResult;
import org.lofarimaging.realtime.application.port.RendererPort;
import org.lofarimaging.realtime.domain.block.BlockArtifactNames;
import org.lofarimaging.realtime.domain.block.XstBlock;
import org.lofarimaging.realtime.domain.station.StationGeometry;
import org.lofarimaging.realtime.logging.Logs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link RendererPort} that runs an external imaging command once per block.
 * <p><strong>How:</strong> The block is written to a scratch {@code .dat} file and the command is started with
 * {@code --dat --station --rcu-mode --subband --timestamp --height --extent --pixels-per-metre [--caltable-dir]
 * --output}. Its stdout is captured and parsed for {@code sky=}, {@code nearfield=} and {@code tracking=} lines.
 * A non-zero exit status or exceeding the timeout fails the render.</p>
 * <p><strong>Thread-safety:</strong> Safe for concurrent calls; every call owns its scratch files.</p>
 *
 * @since 0.1.0
 */
public final class ExternalProcessRenderer implements RendererPort {
  private static final Logger log = LoggerFactory.getLogger(ExternalProcessRenderer.class);

  private static final int STDERR_EXCERPT_LINES = 5;
  private static final int STDERR_EXCERPT_BYTES = 2048;

  private final List<String> command;
  private final Duration timeout;
  private final Path scratchDir;
  private final RenderOutputParser parser = new RenderOutputParser();

  /**
   * Creates the renderer.
   *
   * @param command executable and leading arguments; block arguments are appended
   * @param timeout maximum wall time per render
   * @param scratchDir directory for temporary block and output files; {@code null} uses the system temp dir
   */
  public ExternalProcessRenderer(List<String> command, Duration timeout, Path scratchDir) {
    Objects.requireNonNull(command, "command");
    if (command.isEmpty()) {
      throw new IllegalArgumentException("renderer command must not be empty");
    }
    this.command = List.copyOf(command);
    this.timeout = Objects.requireNonNull(timeout, "timeout");
    if (timeout.isZero() || timeout.isNegative()) {
      throw new IllegalArgumentException("timeout must be positive");
    }
    this.scratchDir = scratchDir;
  }

  @Override
  public RenderResult render(RenderRequest request) throws IOException, InterruptedException {
    Objects.requireNonNull(request, "request");
    XstBlock block = request.block();
    Path datFile = createScratch("block-", BlockArtifactNames.DATA_SUFFIX);
    Path stdoutFile = null;
    Path stderrFile = null;
    try {
      Files.write(datFile, block.data());
      stdoutFile = createScratch("render-", ".out");
      stderrFile = createScratch("render-", ".err");
      List<String> args = arguments(request, datFile);
      ProcessBuilder builder =
          new ProcessBuilder(args)
              .redirectOutput(stdoutFile.toFile())
              .redirectError(stderrFile.toFile());
      log.debug("Rendering block {} with {}", block.sequence(), args);
      Process process = builder.start();
      boolean finished;
      try {
        finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
      } catch (InterruptedException ie) {
        process.destroyForcibly();
        throw ie;
      }
      if (!finished) {
        process.destroyForcibly();
        throw new IOException("Renderer timed out after " + timeout.toMillis() + " ms for block " + block.sequence());
      }
      int exit = process.exitValue();
      if (exit != 0) {
        String stderr = Files.readString(stderrFile, StandardCharsets.UTF_8);
        throw new IOException(
            "Renderer exited with status " + exit + " for block " + block.sequence() + ": "
                + Logs.tail(stderr, STDERR_EXCERPT_LINES, STDERR_EXCERPT_BYTES));
      }
      return parser.parse(Files.readAllLines(stdoutFile, StandardCharsets.UTF_8), request.outputDir());
    } finally {
      deleteQuietly(datFile);
      deleteQuietly(stdoutFile);
      deleteQuietly(stderrFile);
    }
  }

  List<String> arguments(RenderRequest request, Path datFile) {
    XstBlock block = request.block();
    StationGeometry station = request.station();
    List<String> args = new ArrayList<>(command);
    args.add("--dat");
    args.add(datFile.toString());
    args.add("--station");
    args.add(station.stationName());
    args.add("--rcu-mode");
    args.add(Integer.toString(station.rcuMode()));
    args.add("--subband");
    args.add(Integer.toString(block.subband()));
    args.add("--timestamp");
    args.add(block.timestamp().toString());
    args.add("--height");
    args.add(Double.toString(station.heightMetres()));
    args.add("--extent");
    args.add(Double.toString(station.extentMetres()));
    args.add("--pixels-per-metre");
    args.add(Double.toString(station.pixelsPerMetre()));
    if (request.caltableDir() != null) {
      args.add("--caltable-dir");
      args.add(request.caltableDir().toString());
    }
    args.add("--output");
    args.add(request.outputDir().toString());
    return args;
  }

  private Path createScratch(String prefix, String suffix) throws IOException {
    if (scratchDir == null) {
      return Files.createTempFile(prefix, suffix);
    }
    Files.createDirectories(scratchDir);
    return Files.createTempFile(scratchDir, prefix, suffix);
  }

  private static void deleteQuietly(Path file) {
    if (file == null) {
      return;
    }
    try {
      Files.deleteIfExists(file);
    } catch (IOException ex) {
      log.warn("Failed to delete renderer scratch file {}: {}", file, ex.getMessage());
    }
  }
}
