package dev.inkmatch.feature;

import static dev.inkmatch.feature.BandTable.band;

/**
 * Distance-to-location-score policies. Bounds are inclusive upper limits in kilometres.
 *
 * <pre>
 *   km                  5    10   20   25   50   100  200  beyond
 *   CANONICAL           1.0  0.8  0.7  -    0.5  0.3  0.2  0.1
 *   SCORING_FUNCTIONS   1.0  0.9  0.8  -    0.6  0.4  0.2  0.1
 *   MATCHING_FUNCTIONS  -    1.0  -    0.8  0.6  0.4  -    0.2
 * </pre>
 *
 * <p>{@link #CANONICAL} is the default; the other two reproduce the tables of the scoring and bulk
 * matching endpoints and are selectable through {@code inkmatch.matching.distance-profile}.
 */
public enum DistanceBandProfile {
  CANONICAL(
      BandTable.atMost(
          0.1,
          band(5, 1.0),
          band(10, 0.8),
          band(20, 0.7),
          band(50, 0.5),
          band(100, 0.3),
          band(200, 0.2))),
  SCORING_FUNCTIONS(
      BandTable.atMost(
          0.1,
          band(5, 1.0),
          band(10, 0.9),
          band(20, 0.8),
          band(50, 0.6),
          band(100, 0.4),
          band(200, 0.2))),
  MATCHING_FUNCTIONS(
      BandTable.atMost(
          0.2, band(10, 1.0), band(25, 0.8), band(50, 0.6), band(100, 0.4)));

  private final BandTable table;

  DistanceBandProfile(BandTable table) {
    this.table = table;
  }

  public double score(double distanceKm) {
    return table.score(distanceKm);
  }
}
