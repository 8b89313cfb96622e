package dev.inkmatch.evaluator;

import java.time.Duration;

/**
 * Output of one strategy for one candidate.
 *
 * @param strategyName name of the producing strategy; results are keyed by it, never by position
 * @param score match score in [0, 1]
 * @param confidence how much the strategy trusts its score, in [0, 1]; 0 means it abstained
 * @param rationale human-readable account of the score
 * @param elapsed wall time spent in the strategy
 */
public record EvaluatorResult(
    String strategyName, double score, double confidence, String rationale, Duration elapsed) {

  public EvaluatorResult {
    if (strategyName == null || strategyName.isBlank()) {
      throw new IllegalArgumentException("strategyName must not be blank");
    }
    if (!(score >= 0.0 && score <= 1.0)) {
      throw new IllegalArgumentException("score must be in [0, 1], got: " + score);
    }
    if (!(confidence >= 0.0 && confidence <= 1.0)) {
      throw new IllegalArgumentException("confidence must be in [0, 1], got: " + confidence);
    }
    rationale = rationale == null ? "" : rationale;
    elapsed = elapsed == null ? Duration.ZERO : elapsed;
  }

  /** Result with elapsed time still to be stamped by the runner. */
  public static EvaluatorResult of(
      String strategyName, double score, double confidence, String rationale) {
    return new EvaluatorResult(strategyName, score, confidence, rationale, Duration.ZERO);
  }

  /** A result that takes no part in consensus. */
  public static EvaluatorResult abstain(String strategyName, String reason) {
    return new EvaluatorResult(strategyName, 0.0, 0.0, "abstained: " + reason, Duration.ZERO);
  }

  public EvaluatorResult withElapsed(Duration measured) {
    return new EvaluatorResult(strategyName, score, confidence, rationale, measured);
  }
}
