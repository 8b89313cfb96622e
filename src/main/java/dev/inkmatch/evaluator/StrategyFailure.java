package dev.inkmatch.evaluator;

/** Why a strategy produced no result for a candidate. */
public enum StrategyFailure {
  /** Did not finish within its timeout; cancelled and abandoned. */
  TIMEOUT,
  /** Threw while evaluating. */
  ERROR,
  /** Returned nothing, or a result under another strategy's name. */
  INVALID_RESULT
}
