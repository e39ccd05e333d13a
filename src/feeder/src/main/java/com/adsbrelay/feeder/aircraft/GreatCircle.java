package com.adsbrelay.feeder.aircraft;

import com.adsbrelay.feeder.model.GeoPosition;

/** Haversine distance on a spherical Earth. */
final class GreatCircle {
  static final double EARTH_RADIUS_NM = 3440.065;
  static final double KM_PER_NM = 1.852;

  private GreatCircle() {}

  static double distanceNm(GeoPosition from, GeoPosition to) {
    double lat1 = Math.toRadians(from.lat());
    double lat2 = Math.toRadians(to.lat());
    double dLat = lat2 - lat1;
    double dLon = Math.toRadians(to.lon() - from.lon());
    double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
        + Math.cos(lat1) * Math.cos(lat2) * Math.sin(dLon / 2) * Math.sin(dLon / 2);
    return 2 * EARTH_RADIUS_NM * Math.asin(Math.min(1.0, Math.sqrt(a)));
  }
}
