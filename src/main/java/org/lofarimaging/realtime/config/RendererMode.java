package org.lofarimaging.realtime.config;

import java.util.Locale;

/**
 * Selects the imaging adapter behind {@link org.lofarimaging.realtime.application.port.RendererPort}.
 *
 * @since 0.1.0
 */
public enum RendererMode {
  /** Blocks are archived and counted but no images are produced. */
  NONE,
  /** Each surviving block is handed to an external imaging command. */
  PROCESS;

  /**
   * Parses a mode name case-insensitively.
   *
   * @param raw configured value; blank selects {@link #NONE}
   * @return parsed mode
   * @throws IllegalArgumentException if the value names no mode
   */
  public static RendererMode fromString(String raw) {
    if (raw == null || raw.isBlank()) {
      return NONE;
    }
    try {
      return RendererMode.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("renderer must be none or process (was " + raw + ")", ex);
    }
  }
}
