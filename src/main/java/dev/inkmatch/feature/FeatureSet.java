package dev.inkmatch.feature;

import java.util.EnumSet;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Normalized signals for one (request, candidate) pair. Every score lies in [0, 1].
 *
 * @param candidateId the candidate these signals describe
 * @param designSimilarity style, palette and complexity similarity to the portfolio
 * @param locationScore banded proximity score
 * @param priceScore banded budget-to-price score
 * @param experienceScore composite of tenure, rating, review volume and completion
 * @param trackRecord the normalized parts of {@code experienceScore}
 * @param styleDiversity normalized entropy of the portfolio's style distribution
 * @param portfolioSize number of analysed works behind {@code designSimilarity}
 * @param distanceKm great-circle distance, null when either location was unknown
 * @param priceRatio budget over representative price, null when either was unknown
 * @param defaultedSignals signals that carry a neutral default instead of a measurement
 */
public record FeatureSet(
    String candidateId,
    double designSimilarity,
    double locationScore,
    double priceScore,
    double experienceScore,
    TrackRecordSignals trackRecord,
    double styleDiversity,
    int portfolioSize,
    @Nullable Double distanceKm,
    @Nullable Double priceRatio,
    Set<Signal> defaultedSignals) {

  public FeatureSet {
    requireUnit("designSimilarity", designSimilarity);
    requireUnit("locationScore", locationScore);
    requireUnit("priceScore", priceScore);
    requireUnit("experienceScore", experienceScore);
    requireUnit("styleDiversity", styleDiversity);
    defaultedSignals =
        defaultedSignals == null || defaultedSignals.isEmpty()
            ? Set.of()
            : Set.copyOf(EnumSet.copyOf(defaultedSignals));
  }

  public boolean isDefaulted(Signal signal) {
    return defaultedSignals.contains(signal);
  }

  /** The component score for {@code signal}. */
  public double score(Signal signal) {
    return switch (signal) {
      case DESIGN -> designSimilarity;
      case LOCATION -> locationScore;
      case PRICE -> priceScore;
      case EXPERIENCE -> experienceScore;
      case COMPLETION -> trackRecord.completion();
    };
  }

  static void requireUnit(String name, double value) {
    if (!(value >= 0.0 && value <= 1.0)) {
      throw new IllegalArgumentException(name + " must be in [0, 1], got: " + value);
    }
  }
}
