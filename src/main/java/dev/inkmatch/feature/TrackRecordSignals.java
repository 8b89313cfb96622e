package dev.inkmatch.feature;

/**
 * Normalized parts of the experience score, kept separately so strategies can weight them
 * differently.
 *
 * @param tenure years of experience over 10, capped at 1
 * @param rating average rating over 5
 * @param reviewVolume review count over 20, capped at 1
 * @param completion completed over total bookings; 0.5 when there are no bookings
 */
public record TrackRecordSignals(
    double tenure, double rating, double reviewVolume, double completion) {

  public TrackRecordSignals {
    FeatureSet.requireUnit("tenure", tenure);
    FeatureSet.requireUnit("rating", rating);
    FeatureSet.requireUnit("reviewVolume", reviewVolume);
    FeatureSet.requireUnit("completion", completion);
  }
}
