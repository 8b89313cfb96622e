package dev.inkmatch.evaluator;

import java.time.Duration;
import java.util.Map;

/**
 * Per-strategy time limits: a default plus overrides keyed by strategy name.
 *
 * @param defaultTimeout limit for strategies without an override
 * @param overrides limits by {@link ScoringStrategy#name()}
 */
public record StrategyTimeouts(Duration defaultTimeout, Map<String, Duration> overrides) {

  public StrategyTimeouts {
    requirePositive("defaultTimeout", defaultTimeout);
    overrides = overrides == null ? Map.of() : Map.copyOf(overrides);
    overrides.forEach((name, timeout) -> requirePositive("timeout for " + name, timeout));
  }

  public static StrategyTimeouts uniform(Duration timeout) {
    return new StrategyTimeouts(timeout, Map.of());
  }

  public Duration timeoutFor(String strategyName) {
    return overrides.getOrDefault(strategyName, defaultTimeout);
  }

  private static void requirePositive(String name, Duration timeout) {
    if (timeout == null || timeout.isZero() || timeout.isNegative()) {
      throw new IllegalArgumentException(name + " must be positive, got: " + timeout);
    }
  }
}
