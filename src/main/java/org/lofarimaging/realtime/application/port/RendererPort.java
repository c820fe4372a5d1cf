package org.lofarimaging.realtime.application.port;

/**
 * <strong>What:</strong> Port to the external imager that turns a correlation matrix into sky and near-field
 * pictures.
 * <p><strong>Why:</strong> Imaging is heavy numerical work owned by a separate toolchain; the pipeline only
 * schedules it.</p>
 * <p><strong>Role:</strong> Implemented by {@code ExternalProcessRenderer} and {@code DisabledRenderer}; invoked
 * from render worker threads.</p>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate concurrent calls from every worker.</p>
 * <p><strong>Performance:</strong> Calls block for the duration of one render, typically seconds.</p>
 *
 * @since 0.1.0
 */
public interface RendererPort {
  /**
   * Renders one block.
   *
   * @param request block plus geometry and output location
   * @return produced images and tracking data; never {@code null}
   * @throws Exception if rendering fails; the dispatcher records a failed outcome
   */
  RenderResult render(RenderRequest request) throws Exception;
}
