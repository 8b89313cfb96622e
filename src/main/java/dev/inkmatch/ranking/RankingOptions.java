package dev.inkmatch.ranking;

import dev.inkmatch.evaluator.StrategyTimeouts;
import java.time.Duration;

/**
 * Per-call ranking knobs.
 *
 * @param minScore candidates must score strictly above this to be ranked
 * @param topK maximum number of matches returned
 * @param strategyTimeouts time limit for each strategy on each candidate
 */
public record RankingOptions(double minScore, int topK, StrategyTimeouts strategyTimeouts) {

  public static final double DEFAULT_MIN_SCORE = 0.3;
  public static final int DEFAULT_TOP_K = 10;
  public static final Duration DEFAULT_STRATEGY_TIMEOUT = Duration.ofSeconds(5);

  public RankingOptions {
    if (!(minScore >= 0.0 && minScore <= 1.0)) {
      throw new IllegalArgumentException("minScore must be in [0, 1], got: " + minScore);
    }
    if (topK < 1) {
      throw new IllegalArgumentException("topK must be at least 1, got: " + topK);
    }
    if (strategyTimeouts == null) {
      throw new IllegalArgumentException("strategyTimeouts must not be null");
    }
  }

  public RankingOptions(double minScore, int topK, Duration perStrategyTimeout) {
    this(minScore, topK, StrategyTimeouts.uniform(perStrategyTimeout));
  }

  public static RankingOptions defaults() {
    return new RankingOptions(DEFAULT_MIN_SCORE, DEFAULT_TOP_K, DEFAULT_STRATEGY_TIMEOUT);
  }
}
