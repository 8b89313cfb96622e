package dev.inkmatch.evaluator;

import dev.inkmatch.feature.FeatureSet;
import dev.inkmatch.feature.Signal;
import dev.inkmatch.feature.TrackRecordSignals;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Weights customer sentiment over hard fit: how well-reviewed and trusted the artist is, and how
 * well their style resonates with the request. Price is ignored entirely, so unknown pricing never
 * lowers this strategy's confidence.
 *
 * <p>Weights: rating 0.4, design 0.3, review volume 0.15, completion 0.1, location 0.05.
 */
@Component
public class AffectiveStrategy implements ScoringStrategy {

  public static final String NAME = "affective";

  static final double BASE_CONFIDENCE = 0.78;
  static final double DESIGN_WEIGHT = 0.3;
  static final double LOCATION_WEIGHT = 0.05;
  static final double COMPLETION_WEIGHT = 0.1;

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public EvaluatorResult evaluate(FeatureSet features, EvaluationContext context) {
    TrackRecordSignals track = features.trackRecord();
    WeightedTerms terms =
        new WeightedTerms()
            .add("rating", 0.4, track.rating())
            .add("design", DESIGN_WEIGHT, features.designSimilarity())
            .add("reviews", 0.15, track.reviewVolume())
            .add("completion", COMPLETION_WEIGHT, track.completion())
            .add("location", LOCATION_WEIGHT, features.locationScore());

    // Few reviews means little sentiment to go on.
    double evidence = 0.5 + 0.5 * track.reviewVolume();
    double defaultedWeight = 0.0;
    if (features.isDefaulted(Signal.DESIGN)) {
      defaultedWeight += DESIGN_WEIGHT;
    }
    if (features.isDefaulted(Signal.LOCATION)) {
      defaultedWeight += LOCATION_WEIGHT;
    }
    if (features.isDefaulted(Signal.COMPLETION)) {
      defaultedWeight += COMPLETION_WEIGHT;
    }
    double confidence = BASE_CONFIDENCE * evidence * (1.0 - 0.5 * defaultedWeight);

    String rationale =
        terms.describe() + String.format(Locale.ROOT, "; review evidence %.2f", evidence);
    return EvaluatorResult.of(NAME, terms.total(), confidence, rationale);
  }
}
