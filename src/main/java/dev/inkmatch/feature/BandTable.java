package dev.inkmatch.feature;

import java.util.List;

/**
 * A step function from a measured value to a score, defined by an ordered table of bands.
 *
 * <p>{@link Direction#AT_MOST} tables match the first band whose bound is {@code >=} the value
 * (distances); {@link Direction#AT_LEAST} tables match the first band whose bound is {@code <=} the
 * value (ratios). Values matching no band score {@code otherwise}. Bounds are compared with a
 * tolerance of {@value #BOUNDARY_TOLERANCE} so that a value computed to land exactly on a bound
 * falls inside it.
 *
 * @param direction how bounds are compared
 * @param bands bands in evaluation order
 * @param otherwise score for values outside every band
 */
public record BandTable(Direction direction, List<Band> bands, double otherwise) {

  static final double BOUNDARY_TOLERANCE = 1e-9;

  /** Comparison applied between a value and a band's bound. */
  public enum Direction {
    AT_MOST,
    AT_LEAST
  }

  /** One step of the table. */
  public record Band(double bound, double score) {}

  public BandTable {
    bands = List.copyOf(bands);
  }

  /** Table whose bands are inclusive upper bounds, in ascending order. */
  public static BandTable atMost(double otherwise, Band... bands) {
    return new BandTable(Direction.AT_MOST, List.of(bands), otherwise);
  }

  /** Table whose bands are inclusive lower bounds, in descending order. */
  public static BandTable atLeast(double otherwise, Band... bands) {
    return new BandTable(Direction.AT_LEAST, List.of(bands), otherwise);
  }

  public static Band band(double bound, double score) {
    return new Band(bound, score);
  }

  /**
   * @param value the measured value
   * @return the score of the first matching band, or {@code otherwise}
   */
  public double score(double value) {
    for (Band band : bands) {
      boolean matches =
          direction == Direction.AT_MOST
              ? value <= band.bound() + BOUNDARY_TOLERANCE
              : value >= band.bound() - BOUNDARY_TOLERANCE;
      if (matches) {
        return band.score();
      }
    }
    return otherwise;
  }
}
