package dev.inkmatch.evaluator;

import dev.inkmatch.feature.FeatureSet;

/**
 * One pluggable way of turning a {@link FeatureSet} into a score.
 *
 * <p>Implementations are stateless and may be called concurrently for different candidates. They
 * may be slow; the {@link EvaluatorRunner} bounds each call with its own timeout. For well-formed
 * feature sets they must not throw. A strategy that cannot judge a candidate abstains with
 * confidence 0. Confidence must only reflect the signals the strategy actually uses.
 */
public interface ScoringStrategy {

  /** Unique, stable name; used as the key of the strategy's result and timeout override. */
  String name();

  /**
   * @param features signals for the candidate
   * @param context identifies the request and candidate
   * @return the strategy's verdict
   */
  EvaluatorResult evaluate(FeatureSet features, EvaluationContext context);
}
