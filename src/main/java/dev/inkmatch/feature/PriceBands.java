package dev.inkmatch.feature;

import static dev.inkmatch.feature.BandTable.band;

/**
 * Budget-to-price ratio bands. Bounds are inclusive lower limits on {@code budget / price}.
 *
 * <pre>
 *   ratio &gt;= 1.5  1.0   budget comfortably covers the price
 *   ratio &gt;= 1.2  0.9
 *   ratio &gt;= 1.0  0.8   budget meets the price
 *   ratio &gt;= 0.8  0.6
 *   ratio &gt;= 0.6  0.3
 *   below        0.1   likely unaffordable
 * </pre>
 */
public final class PriceBands {

  public static final BandTable TABLE =
      BandTable.atLeast(
          0.1, band(1.5, 1.0), band(1.2, 0.9), band(1.0, 0.8), band(0.8, 0.6), band(0.6, 0.3));

  private PriceBands() {}

  public static double score(double ratio) {
    return TABLE.score(ratio);
  }
}
