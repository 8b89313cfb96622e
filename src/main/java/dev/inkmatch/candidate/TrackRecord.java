package dev.inkmatch.candidate;

import java.util.OptionalDouble;

/**
 * An artist's track record at the time of the snapshot.
 *
 * @param experienceYears years of professional experience
 * @param averageRating average review rating on a 0-5 scale
 * @param reviewCount number of reviews behind {@code averageRating}
 * @param completedBookings bookings completed
 * @param totalBookings bookings accepted, completed or not
 */
public record TrackRecord(
    double experienceYears,
    double averageRating,
    int reviewCount,
    int completedBookings,
    int totalBookings) {

  /** Track record of an artist with no history on the platform. */
  public static TrackRecord none() {
    return new TrackRecord(0.0, 0.0, 0, 0, 0);
  }

  /** Completed over total bookings, or empty when the artist has no bookings yet. */
  public OptionalDouble completionRate() {
    if (totalBookings <= 0) {
      return OptionalDouble.empty();
    }
    return OptionalDouble.of(Math.min(1.0, (double) completedBookings / totalBookings));
  }

  public boolean wellFormed() {
    return Double.isFinite(experienceYears)
        && experienceYears >= 0.0
        && Double.isFinite(averageRating)
        && averageRating >= 0.0
        && averageRating <= 5.0
        && reviewCount >= 0
        && completedBookings >= 0
        && totalBookings >= 0
        && completedBookings <= totalBookings;
  }
}
