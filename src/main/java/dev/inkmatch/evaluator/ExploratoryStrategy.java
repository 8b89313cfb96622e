package dev.inkmatch.evaluator;

import dev.inkmatch.feature.FeatureSet;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Surfaces non-obvious but plausible matches: versatile portfolios and partial design fits score
 * higher than exact look-alikes.
 *
 * <ul>
 *   <li>diversity (0.4): entropy of the portfolio's style distribution
 *   <li>serendipity (0.3): {@code 1 - 2|design - 0.5|}, peaking on a half match
 *   <li>plausibility (0.3): mean of design similarity and experience, so novelty alone cannot win
 * </ul>
 *
 * <p>Confidence grows with portfolio size up to {@value #FULL_CONFIDENCE_PORTFOLIO} works. With an
 * empty portfolio there is no pattern to read and the strategy abstains.
 */
@Component
public class ExploratoryStrategy implements ScoringStrategy {

  public static final String NAME = "exploratory";

  static final double BASE_CONFIDENCE = 0.72;
  static final int FULL_CONFIDENCE_PORTFOLIO = 5;

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public EvaluatorResult evaluate(FeatureSet features, EvaluationContext context) {
    if (features.portfolioSize() == 0) {
      return EvaluatorResult.abstain(NAME, "no portfolio to read patterns from");
    }
    double design = features.designSimilarity();
    double serendipity = Math.max(0.0, 1.0 - 2.0 * Math.abs(design - 0.5));
    double plausibility = (design + features.experienceScore()) / 2.0;

    WeightedTerms terms =
        new WeightedTerms()
            .add("diversity", 0.4, features.styleDiversity())
            .add("serendipity", 0.3, serendipity)
            .add("plausibility", 0.3, plausibility);

    double coverage = Math.min(1.0, (double) features.portfolioSize() / FULL_CONFIDENCE_PORTFOLIO);
    double confidence = BASE_CONFIDENCE * coverage;

    String rationale =
        terms.describe()
            + String.format(
                Locale.ROOT,
                "; %d portfolio works, coverage %.2f",
                features.portfolioSize(),
                coverage);
    return EvaluatorResult.of(NAME, terms.total(), confidence, rationale);
  }
}
