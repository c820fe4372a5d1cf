package org.lofarimaging.realtime.application.port;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import org.lofarimaging.realtime.domain.status.ImageLogEntry;

/**
 * <strong>What:</strong> Port reading and writing an observation's image log ({@code session_log.json}).
 * <p><strong>Role:</strong> Implemented by {@code JsonSessionLogStore}; written once at the end of an
 * observation and read back by the history view.</p>
 * <p><strong>Thread-safety:</strong> Implementations are stateless and safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public interface SessionLogPort {
  /**
   * Writes the entries, replacing any existing log.
   *
   * @param file target file
   * @param entries entries in any order
   * @throws IOException if the file cannot be written
   */
  void save(Path file, List<ImageLogEntry> entries) throws IOException;

  /**
   * Reads a log written by {@link #save(Path, List)} or by the legacy dashboard.
   *
   * @param file log file
   * @return entries in file order
   * @throws IOException if the file cannot be read or is malformed
   */
  List<ImageLogEntry> load(Path file) throws IOException;
}
