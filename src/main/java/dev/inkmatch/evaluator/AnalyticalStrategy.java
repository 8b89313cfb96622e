package dev.inkmatch.evaluator;

import dev.inkmatch.feature.FeatureSet;
import dev.inkmatch.feature.Signal;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Deterministic linear score over the four component signals.
 *
 * <p>Weights: design 0.4, experience 0.3, price 0.2, location 0.1. Confidence starts at {@value
 * #BASE_CONFIDENCE} and loses half the weight of every signal that carried a neutral default.
 */
@Component
public class AnalyticalStrategy implements ScoringStrategy {

  public static final String NAME = "analytical";

  static final double BASE_CONFIDENCE = 0.9;

  static final Map<Signal, Double> WEIGHTS = new EnumMap<>(Signal.class);

  static {
    WEIGHTS.put(Signal.DESIGN, 0.4);
    WEIGHTS.put(Signal.EXPERIENCE, 0.3);
    WEIGHTS.put(Signal.PRICE, 0.2);
    WEIGHTS.put(Signal.LOCATION, 0.1);
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public EvaluatorResult evaluate(FeatureSet features, EvaluationContext context) {
    WeightedTerms terms = new WeightedTerms();
    double defaultedWeight = 0.0;
    for (Map.Entry<Signal, Double> weight : WEIGHTS.entrySet()) {
      Signal signal = weight.getKey();
      terms.add(signal.name().toLowerCase(Locale.ROOT), weight.getValue(), features.score(signal));
      if (features.isDefaulted(signal)) {
        defaultedWeight += weight.getValue();
      }
    }
    double confidence = BASE_CONFIDENCE * (1.0 - 0.5 * defaultedWeight);
    return EvaluatorResult.of(NAME, terms.total(), confidence, terms.describe());
  }
}
