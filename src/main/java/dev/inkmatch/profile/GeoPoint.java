package dev.inkmatch.profile;

/**
 * A latitude/longitude pair in decimal degrees.
 *
 * <p>Range and finiteness are not enforced here; the ranking pipeline rejects malformed points
 * before feature extraction so they are reported rather than thrown from deserialization.
 */
public record GeoPoint(double latitude, double longitude) {

  public boolean wellFormed() {
    return Double.isFinite(latitude)
        && Double.isFinite(longitude)
        && latitude >= -90.0
        && latitude <= 90.0
        && longitude >= -180.0
        && longitude <= 180.0;
  }
}
