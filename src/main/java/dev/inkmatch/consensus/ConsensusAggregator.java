package dev.inkmatch.consensus;

import dev.inkmatch.evaluator.EvaluatorResult;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Merges evaluator results into one {@link ConsensusDecision}.
 *
 * <ol>
 *   <li>Results with confidence at or below the floor are dropped; if none remain the call fails
 *       with {@link NoQuorumException}.
 *   <li>{@code overallConfidence = Σ confidence / n}
 *   <li>{@code finalScore = Σ (score × confidence) / Σ confidence}
 *   <li>If the spread {@code max(score) - min(score)} exceeds the conflict threshold the decision
 *       is flagged, with the spread as its magnitude. A conflict never blocks the decision.
 * </ol>
 *
 * <p>Results are sorted by strategy name before summation, so any permutation of the input gives
 * bit-identical output.
 */
public class ConsensusAggregator {

  public static final double DEFAULT_CONFIDENCE_FLOOR = 0.3;
  public static final double DEFAULT_CONFLICT_THRESHOLD = 0.35;

  private static final Comparator<EvaluatorResult> CANONICAL_ORDER =
      Comparator.comparing(EvaluatorResult::strategyName)
          .thenComparingDouble(EvaluatorResult::confidence)
          .thenComparingDouble(EvaluatorResult::score);

  private final double confidenceFloor;
  private final double conflictThreshold;

  public ConsensusAggregator(double confidenceFloor, double conflictThreshold) {
    if (!(confidenceFloor >= 0.0 && confidenceFloor < 1.0)) {
      throw new IllegalArgumentException(
          "confidenceFloor must be in [0, 1), got: " + confidenceFloor);
    }
    if (!(conflictThreshold >= 0.0 && conflictThreshold <= 1.0)) {
      throw new IllegalArgumentException(
          "conflictThreshold must be in [0, 1], got: " + conflictThreshold);
    }
    this.confidenceFloor = confidenceFloor;
    this.conflictThreshold = conflictThreshold;
  }

  public ConsensusAggregator() {
    this(DEFAULT_CONFIDENCE_FLOOR, DEFAULT_CONFLICT_THRESHOLD);
  }

  /**
   * @param results completed results for one candidate, in any order
   * @return the merged decision
   * @throws NoQuorumException if {@code results} is empty or no result clears the floor
   */
  public ConsensusDecision aggregate(List<EvaluatorResult> results) {
    List<EvaluatorResult> surviving = new ArrayList<>(results.size());
    for (EvaluatorResult result : results) {
      if (result.confidence() > confidenceFloor) {
        surviving.add(result);
      }
    }
    if (surviving.isEmpty()) {
      throw new NoQuorumException(results.size(), confidenceFloor);
    }
    surviving.sort(CANONICAL_ORDER);

    double confidenceSum = 0.0;
    double weightedScoreSum = 0.0;
    double minScore = Double.POSITIVE_INFINITY;
    double maxScore = Double.NEGATIVE_INFINITY;
    List<String> contributing = new ArrayList<>(surviving.size());
    for (EvaluatorResult result : surviving) {
      confidenceSum += result.confidence();
      weightedScoreSum += result.score() * result.confidence();
      minScore = Math.min(minScore, result.score());
      maxScore = Math.max(maxScore, result.score());
      contributing.add(result.strategyName());
    }

    double finalScore = clampUnit(weightedScoreSum / confidenceSum);
    double overallConfidence = clampUnit(confidenceSum / surviving.size());
    double spread = maxScore - minScore;
    boolean conflict = spread > conflictThreshold;

    return new ConsensusDecision(
        finalScore, overallConfidence, contributing, conflict, conflict ? spread : 0.0);
  }

  public double getConfidenceFloor() {
    return confidenceFloor;
  }

  public double getConflictThreshold() {
    return conflictThreshold;
  }

  // Rounding can push a mean of unit values a hair outside [0, 1].
  private static double clampUnit(double value) {
    return Math.max(0.0, Math.min(1.0, value));
  }
}
