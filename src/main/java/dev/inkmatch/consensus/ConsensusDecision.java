package dev.inkmatch.consensus;

import java.util.List;

/**
 * Merged verdict of all confident strategies for one candidate.
 *
 * @param finalScore confidence-weighted mean of the surviving scores
 * @param overallConfidence plain mean of the surviving confidences
 * @param contributingStrategies names of the strategies that survived the floor, sorted
 * @param conflict whether the surviving scores spread wider than the conflict threshold
 * @param conflictMagnitude the score spread when {@code conflict}, otherwise 0
 */
public record ConsensusDecision(
    double finalScore,
    double overallConfidence,
    List<String> contributingStrategies,
    boolean conflict,
    double conflictMagnitude) {

  public ConsensusDecision {
    if (!(finalScore >= 0.0 && finalScore <= 1.0)) {
      throw new IllegalArgumentException("finalScore must be in [0, 1], got: " + finalScore);
    }
    if (!(overallConfidence >= 0.0 && overallConfidence <= 1.0)) {
      throw new IllegalArgumentException(
          "overallConfidence must be in [0, 1], got: " + overallConfidence);
    }
    contributingStrategies = List.copyOf(contributingStrategies);
  }

  public boolean contributedBy(String strategyName) {
    return contributingStrategies.contains(strategyName);
  }
}
