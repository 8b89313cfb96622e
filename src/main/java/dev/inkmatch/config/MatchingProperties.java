package dev.inkmatch.config;

import dev.inkmatch.consensus.ConsensusAggregator;
import dev.inkmatch.evaluator.StrategyTimeouts;
import dev.inkmatch.feature.DistanceBandProfile;
import dev.inkmatch.ranking.RankingOptions;
import jakarta.annotation.PostConstruct;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for the matching engine.
 *
 * <p>Properties are bound from {@code inkmatch.matching.*} in application.yml.
 *
 * <ul>
 *   <li>{@code min-score} - candidates must score strictly above this (default 0.3)
 *   <li>{@code top-k} - maximum matches returned (default 10)
 *   <li>{@code confidence-floor} - strategy results at or below this confidence are ignored by
 *       consensus (default 0.3)
 *   <li>{@code conflict-threshold} - score spread above which a decision is flagged (default 0.35)
 *   <li>{@code strategy-timeout} - default per-strategy time limit (default 5s)
 *   <li>{@code strategy-timeouts.<name>} - per-strategy overrides
 *   <li>{@code candidate-parallelism} - candidate units evaluated in parallel (default 8)
 *   <li>{@code strategy-pool-size} - threads running strategies (default 16)
 *   <li>{@code distance-profile} - distance band table (default CANONICAL)
 * </ul>
 *
 * <p>Validated at startup via {@link #validate()}; the application fails to start if values are out
 * of range.
 */
@Configuration
@ConfigurationProperties(prefix = "inkmatch.matching")
public class MatchingProperties {

  private double minScore = RankingOptions.DEFAULT_MIN_SCORE;
  private int topK = RankingOptions.DEFAULT_TOP_K;
  private double confidenceFloor = ConsensusAggregator.DEFAULT_CONFIDENCE_FLOOR;
  private double conflictThreshold = ConsensusAggregator.DEFAULT_CONFLICT_THRESHOLD;
  private Duration strategyTimeout = RankingOptions.DEFAULT_STRATEGY_TIMEOUT;
  private Map<String, Duration> strategyTimeouts = new LinkedHashMap<>();
  private int candidateParallelism = 8;
  private int strategyPoolSize = 16;
  private DistanceBandProfile distanceProfile = DistanceBandProfile.CANONICAL;

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (minScore < 0.0 || minScore > 1.0) {
      throw new IllegalStateException(
          "inkmatch.matching.min-score must be in [0.0, 1.0], got: " + minScore);
    }
    if (topK < 1 || topK > 1000) {
      throw new IllegalStateException(
          "inkmatch.matching.top-k must be in [1, 1000], got: " + topK);
    }
    if (confidenceFloor < 0.0 || confidenceFloor >= 1.0) {
      throw new IllegalStateException(
          "inkmatch.matching.confidence-floor must be in [0.0, 1.0), got: " + confidenceFloor);
    }
    if (conflictThreshold < 0.0 || conflictThreshold > 1.0) {
      throw new IllegalStateException(
          "inkmatch.matching.conflict-threshold must be in [0.0, 1.0], got: "
              + conflictThreshold);
    }
    requirePositive("inkmatch.matching.strategy-timeout", strategyTimeout);
    strategyTimeouts.forEach(
        (name, timeout) -> requirePositive("inkmatch.matching.strategy-timeouts." + name, timeout));
    if (candidateParallelism < 1 || candidateParallelism > 256) {
      throw new IllegalStateException(
          "inkmatch.matching.candidate-parallelism must be in [1, 256], got: "
              + candidateParallelism);
    }
    if (strategyPoolSize < 1 || strategyPoolSize > 512) {
      throw new IllegalStateException(
          "inkmatch.matching.strategy-pool-size must be in [1, 512], got: " + strategyPoolSize);
    }
    if (distanceProfile == null) {
      throw new IllegalStateException("inkmatch.matching.distance-profile must be set");
    }
  }

  private static void requirePositive(String property, Duration timeout) {
    if (timeout == null || timeout.isZero() || timeout.isNegative()) {
      throw new IllegalStateException(property + " must be positive, got: " + timeout);
    }
  }

  public StrategyTimeouts toStrategyTimeouts() {
    return new StrategyTimeouts(strategyTimeout, strategyTimeouts);
  }

  /** Ranking options used when a caller does not override them. */
  public RankingOptions defaultOptions() {
    return new RankingOptions(minScore, topK, toStrategyTimeouts());
  }

  public double getMinScore() {
    return minScore;
  }

  public void setMinScore(double minScore) {
    this.minScore = minScore;
  }

  public int getTopK() {
    return topK;
  }

  public void setTopK(int topK) {
    this.topK = topK;
  }

  public double getConfidenceFloor() {
    return confidenceFloor;
  }

  public void setConfidenceFloor(double confidenceFloor) {
    this.confidenceFloor = confidenceFloor;
  }

  public double getConflictThreshold() {
    return conflictThreshold;
  }

  public void setConflictThreshold(double conflictThreshold) {
    this.conflictThreshold = conflictThreshold;
  }

  public Duration getStrategyTimeout() {
    return strategyTimeout;
  }

  public void setStrategyTimeout(Duration strategyTimeout) {
    this.strategyTimeout = strategyTimeout;
  }

  public Map<String, Duration> getStrategyTimeouts() {
    return strategyTimeouts;
  }

  public void setStrategyTimeouts(Map<String, Duration> strategyTimeouts) {
    this.strategyTimeouts = strategyTimeouts;
  }

  public int getCandidateParallelism() {
    return candidateParallelism;
  }

  public void setCandidateParallelism(int candidateParallelism) {
    this.candidateParallelism = candidateParallelism;
  }

  public int getStrategyPoolSize() {
    return strategyPoolSize;
  }

  public void setStrategyPoolSize(int strategyPoolSize) {
    this.strategyPoolSize = strategyPoolSize;
  }

  public DistanceBandProfile getDistanceProfile() {
    return distanceProfile;
  }

  public void setDistanceProfile(DistanceBandProfile distanceProfile) {
    this.distanceProfile = distanceProfile;
  }
}
