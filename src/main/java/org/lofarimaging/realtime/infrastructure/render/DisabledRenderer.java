package org.lofarimaging.realtime.infrastructure.render;

import org.lofarimaging.realtime.application.port.RenderRequest;
import org.lofarimaging.realtime.application.port.RenderResult;
import org.lofarimaging.realtime.application.port.RendererPort;

/**
 * Renderer used when no imager is configured: every block completes immediately with no images, so
 * acquisition, archiving, and status still run.
 *
 * @since 0.1.0
 */
public final class DisabledRenderer implements RendererPort {
  @Override
  public RenderResult render(RenderRequest request) {
    return RenderResult.empty();
  }
}
