package dev.inkmatch.feature;

import dev.inkmatch.profile.GeoPoint;

/**
 * Great-circle distance between two points on a spherical Earth of radius {@value
 * #EARTH_RADIUS_KM} km. Coordinates are in decimal degrees.
 */
public final class Haversine {

  static final double EARTH_RADIUS_KM = 6371.0;

  private Haversine() {}

  /**
   * @param from first point
   * @param to second point
   * @return distance in kilometres
   */
  public static double distanceKm(GeoPoint from, GeoPoint to) {
    double phi1 = Math.toRadians(from.latitude());
    double phi2 = Math.toRadians(to.latitude());
    double dPhi = Math.toRadians(to.latitude() - from.latitude());
    double dLambda = Math.toRadians(to.longitude() - from.longitude());
    double a =
        Math.sin(dPhi / 2) * Math.sin(dPhi / 2)
            + Math.cos(phi1) * Math.cos(phi2) * Math.sin(dLambda / 2) * Math.sin(dLambda / 2);
    // Rounding can push near-antipodal pairs just past 1.
    a = Math.min(1.0, Math.max(0.0, a));
    double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
    return EARTH_RADIUS_KM * c;
  }
}
