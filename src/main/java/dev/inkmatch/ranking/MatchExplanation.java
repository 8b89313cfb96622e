package dev.inkmatch.ranking;

import dev.inkmatch.evaluator.StrategyFailure;
import dev.inkmatch.feature.FeatureSet;
import java.util.List;
import java.util.Map;

/**
 * Audit view of a {@link RankedMatch}.
 *
 * @param candidateId the ranked candidate
 * @param rank its position
 * @param finalScore merged score
 * @param overallConfidence merged confidence
 * @param strategies per-strategy breakdown sorted by strategy name
 * @param skippedStrategies strategies without a result and why
 * @param conflict whether the strategies disagreed beyond the threshold
 * @param conflictMagnitude score spread when in conflict, otherwise 0
 * @param features the signals behind the scores
 */
public record MatchExplanation(
    String candidateId,
    int rank,
    double finalScore,
    double overallConfidence,
    List<StrategyBreakdown> strategies,
    Map<String, StrategyFailure> skippedStrategies,
    boolean conflict,
    double conflictMagnitude,
    FeatureSet features) {

  public MatchExplanation {
    strategies = List.copyOf(strategies);
    skippedStrategies = Map.copyOf(skippedStrategies);
  }
}
