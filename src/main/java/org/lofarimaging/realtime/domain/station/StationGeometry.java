package org.lofarimaging.realtime.domain.station;

import java.util.Objects;

/**
 * <strong>What:</strong> Station identity plus the near-field imaging geometry used for every render.
 * <p><strong>Role:</strong> Domain value copied into each render request and into the status snapshot.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param stationName station name such as {@code LV614}
 * @param stationType station class derived from the name
 * @param rcuMode RCU mode (observing band) passed to the renderer
 * @param heightMetres near-field imaging height above the station in metres
 * @param extentMetres half-width of the near-field image in metres
 * @since 0.1.0
 */
public record StationGeometry(
    String stationName, StationType stationType, int rcuMode, double heightMetres, double extentMetres) {
  /** Near-field image width in pixels across the full extent. */
  public static final double NEAR_FIELD_PIXELS = 150.0;

  public StationGeometry {
    Objects.requireNonNull(stationName, "stationName");
    Objects.requireNonNull(stationType, "stationType");
    if (rcuMode < 1 || rcuMode > 7) {
      throw new IllegalArgumentException("rcuMode must be between 1 and 7 (was " + rcuMode + ")");
    }
    if (!(extentMetres > 0) || Double.isInfinite(extentMetres)) {
      throw new IllegalArgumentException("extentMetres must be positive (was " + extentMetres + ")");
    }
    if (Double.isNaN(heightMetres) || Double.isInfinite(heightMetres)) {
      throw new IllegalArgumentException("heightMetres must be finite");
    }
  }

  /**
   * Builds the geometry for a named station, deriving its class from the name.
   *
   * @param stationName station name
   * @param rcuMode RCU mode
   * @param heightMetres imaging height in metres
   * @param extentMetres image half-width in metres
   * @return geometry
   */
  public static StationGeometry of(String stationName, int rcuMode, double heightMetres, double extentMetres) {
    return new StationGeometry(
        stationName, StationType.fromStationName(stationName), rcuMode, heightMetres, extentMetres);
  }

  /** XST matrix dimension for this station. */
  public int dimension() {
    return stationType.rcuCount();
  }

  /** Image bounds as {@code [-e, e, -e, e]}. */
  public double[] extent() {
    return new double[] {-extentMetres, extentMetres, -extentMetres, extentMetres};
  }

  /** Pixel density of the near-field image, {@code 150 / (2e)}. */
  public double pixelsPerMetre() {
    return NEAR_FIELD_PIXELS / (2 * extentMetres);
  }
}
