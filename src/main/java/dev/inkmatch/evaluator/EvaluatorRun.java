package dev.inkmatch.evaluator;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Outcome of running every strategy for one candidate.
 *
 * @param results completed results, in completion order
 * @param skipped strategies that produced no result, with the reason
 */
public record EvaluatorRun(List<EvaluatorResult> results, Map<String, StrategyFailure> skipped) {

  public EvaluatorRun {
    results = List.copyOf(results);
    skipped = Collections.unmodifiableMap(new TreeMap<>(skipped));
  }

  public long timeoutCount() {
    return skipped.values().stream().filter(f -> f == StrategyFailure.TIMEOUT).count();
  }
}
