package dev.inkmatch.fixture;

import dev.inkmatch.profile.GeoPoint;

/** Reference coordinates for distance-dependent tests. */
public final class Places {

  public static final GeoPoint TOKYO_STATION = new GeoPoint(35.6812, 139.7671);

  private static final double EARTH_RADIUS_KM = 6371.0;

  private Places() {}

  /** Point {@code km} due north of {@code origin}; along a meridian the arc length is exact. */
  public static GeoPoint northOf(GeoPoint origin, double km) {
    return new GeoPoint(
        origin.latitude() + Math.toDegrees(km / EARTH_RADIUS_KM), origin.longitude());
  }
}
