package org.lofarimaging.realtime.domain.station;

import java.util.Locale;

/**
 * LOFAR station classes and the number of RCUs (receiver units) each correlates.
 *
 * @since 0.1.0
 */
public enum StationType {
  CORE(96),
  REMOTE(96),
  INTERNATIONAL(192);

  private final int rcuCount;

  StationType(int rcuCount) {
    this.rcuCount = rcuCount;
  }

  /** Number of RCUs, which is also the XST matrix dimension. */
  public int rcuCount() {
    return rcuCount;
  }

  /**
   * Classifies a station from its name. Core stations start with {@code C}, remote stations with {@code R}
   * (plus {@code PL611}, which is built to the remote layout); everything else is international.
   *
   * @param stationName station name such as {@code CS002}, {@code RS509} or {@code LV614}
   * @return station class
   * @throws IllegalArgumentException if the name is blank
   */
  public static StationType fromStationName(String stationName) {
    if (stationName == null || stationName.isBlank()) {
      throw new IllegalArgumentException("station name must not be blank");
    }
    String name = stationName.strip().toUpperCase(Locale.ROOT);
    if (name.startsWith("C")) {
      return CORE;
    }
    if (name.startsWith("R") || name.startsWith("PL611")) {
      return REMOTE;
    }
    return INTERNATIONAL;
  }
}
