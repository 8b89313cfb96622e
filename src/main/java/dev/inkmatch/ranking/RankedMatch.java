package dev.inkmatch.ranking;

import dev.inkmatch.candidate.Candidate;
import dev.inkmatch.consensus.ConsensusDecision;
import dev.inkmatch.evaluator.EvaluatorResult;
import dev.inkmatch.evaluator.StrategyFailure;
import dev.inkmatch.feature.FeatureSet;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * One ranked candidate together with everything needed to explain its position.
 *
 * @param rank 1-based position in the result
 * @param candidate the snapshot that was scored
 * @param decision merged strategy verdict
 * @param features signals the strategies saw
 * @param evaluations every completed strategy result, including those below the confidence floor
 * @param skippedStrategies strategies that produced no result, with the reason
 */
public record RankedMatch(
    int rank,
    Candidate candidate,
    ConsensusDecision decision,
    FeatureSet features,
    List<EvaluatorResult> evaluations,
    Map<String, StrategyFailure> skippedStrategies) {

  public RankedMatch {
    if (rank < 1) {
      throw new IllegalArgumentException("rank must be at least 1, got: " + rank);
    }
    evaluations = List.copyOf(evaluations);
    skippedStrategies =
        skippedStrategies == null
            ? Map.of()
            : Collections.unmodifiableMap(new TreeMap<>(skippedStrategies));
  }

  RankedMatch withRank(int newRank) {
    return new RankedMatch(newRank, candidate, decision, features, evaluations, skippedStrategies);
  }
}
