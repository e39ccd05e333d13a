package com.adsbrelay.feeder.decode;

import com.adsbrelay.feeder.model.GeoPosition;
import java.util.Optional;

/**
 * Compact Position Reporting (CPR) global decoding.
 *
 * <p>Inputs are the raw 17-bit latitude/longitude fields already scaled to {@code [0, 1)}.
 */
final class CprMath {
  private static final double CPR_SCALE = 131_072.0;
  private static final int ZONES = 15;

  private CprMath() {}

  static double scale(long raw) {
    return raw / CPR_SCALE;
  }

  /**
   * Number of longitude zones for a latitude (the CPR {@code NL} function).
   *
   * @param lat latitude in degrees
   * @return zone count between 1 and 59
   */
  static int longitudeZones(double lat) {
    double abs = Math.abs(lat);
    if (abs <= 1e-8) {
      return 59;
    }
    if (Math.abs(abs - 87.0) <= 1e-8 + 1e-5 * 87.0) {
      return 2;
    }
    if (abs > 87.0) {
      return 1;
    }
    double a = 1 - Math.cos(Math.PI / (2 * ZONES));
    double cosLat = Math.cos(Math.toRadians(abs));
    double b = cosLat * cosLat;
    return (int) Math.floor(2 * Math.PI / Math.acos(1 - a / b));
  }

  static Optional<GeoPosition> airborne(
      double latEven, double lonEven, double latOdd, double lonOdd, boolean evenIsNewer) {
    double dLatEven = 360.0 / 60;
    double dLatOdd = 360.0 / 59;
    int j = (int) Math.floor(59 * latEven - 60 * latOdd + 0.5);

    double lat0 = dLatEven * (Math.floorMod(j, 60) + latEven);
    double lat1 = dLatOdd * (Math.floorMod(j, 59) + latOdd);
    if (lat0 >= 270) {
      lat0 -= 360;
    }
    if (lat1 >= 270) {
      lat1 -= 360;
    }
    if (longitudeZones(lat0) != longitudeZones(lat1)) {
      return Optional.empty();
    }

    double lat = evenIsNewer ? lat0 : lat1;
    double lon = longitude(360.0, lat, lonEven, lonOdd, evenIsNewer);
    if (lon > 180) {
      lon -= 360;
    }
    return Optional.of(new GeoPosition(round5(lat), round5(lon)));
  }

  static Optional<GeoPosition> surface(
      double latEven,
      double lonEven,
      double latOdd,
      double lonOdd,
      boolean evenIsNewer,
      GeoPosition reference) {
    double dLatEven = 90.0 / 60;
    double dLatOdd = 90.0 / 59;
    int j = (int) Math.floor(59 * latEven - 60 * latOdd + 0.5);

    double lat0 = dLatEven * (Math.floorMod(j, 60) + latEven);
    double lat1 = dLatOdd * (Math.floorMod(j, 59) + latOdd);
    // Surface encoding is ambiguous by hemisphere; the reference picks one.
    if (reference.lat() <= 0) {
      lat0 -= 90;
      lat1 -= 90;
    }
    if (longitudeZones(lat0) != longitudeZones(lat1)) {
      return Optional.empty();
    }

    double lat = evenIsNewer ? lat0 : lat1;
    double base = longitude(90.0, lat, lonEven, lonOdd, evenIsNewer);

    double best = Double.NaN;
    for (int quadrant = 0; quadrant < 4; quadrant++) {
      double candidate = normalizeLongitude(base + 90.0 * quadrant);
      if (Double.isNaN(best)
          || Math.abs(candidate - reference.lon()) < Math.abs(best - reference.lon())) {
        best = candidate;
      }
    }
    return Optional.of(new GeoPosition(round5(lat), round5(best)));
  }

  private static double longitude(
      double span, double lat, double lonEven, double lonOdd, boolean evenIsNewer) {
    int nl = longitudeZones(lat);
    int ni = Math.max(evenIsNewer ? nl : nl - 1, 1);
    int m = (int) Math.floor(lonEven * (nl - 1) - lonOdd * nl + 0.5);
    double fraction = evenIsNewer ? lonEven : lonOdd;
    return (span / ni) * (Math.floorMod(m, ni) + fraction);
  }

  private static double normalizeLongitude(double lon) {
    double shifted = (lon + 180.0) % 360.0;
    if (shifted < 0) {
      shifted += 360.0;
    }
    return shifted - 180.0;
  }

  private static double round5(double value) {
    return Math.round(value * 100_000.0) / 100_000.0;
  }
}
