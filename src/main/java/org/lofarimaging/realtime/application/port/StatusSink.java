package org.lofarimaging.realtime.application.port;

import java.io.IOException;
import java.nio.file.Path;
import org.lofarimaging.realtime.domain.status.StatusSnapshot;

/**
 * Port publishing a status snapshot for external readers such as a dashboard.
 *
 * @since 0.1.0
 */
public interface StatusSink {
  /**
   * Publishes the snapshot to {@code target}.
   *
   * @param snapshot snapshot to publish
   * @param target destination file
   * @throws IOException if the snapshot cannot be written
   */
  void publish(StatusSnapshot snapshot, Path target) throws IOException;
}
