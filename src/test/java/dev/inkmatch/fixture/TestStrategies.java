package dev.inkmatch.fixture;

import dev.inkmatch.evaluator.EvaluationContext;
import dev.inkmatch.evaluator.EvaluatorResult;
import dev.inkmatch.evaluator.ScoringStrategy;
import dev.inkmatch.feature.FeatureSet;
import java.util.concurrent.CountDownLatch;

/** Scripted {@link ScoringStrategy} implementations for runner and pipeline tests. */
public final class TestStrategies {

  private TestStrategies() {}

  /** Returns a fixed verdict, optionally after sleeping; gives up if interrupted while asleep. */
  public static ScoringStrategy fixed(
      String name, double score, double confidence, long sleepMillis) {
    return new ScoringStrategy() {
      @Override
      public String name() {
        return name;
      }

      @Override
      public EvaluatorResult evaluate(FeatureSet features, EvaluationContext context) {
        if (sleepMillis > 0) {
          try {
            Thread.sleep(sleepMillis);
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted", e);
          }
        }
        return EvaluatorResult.of(name, score, confidence, "fixed");
      }
    };
  }

  public static ScoringStrategy fixed(String name, double score, double confidence) {
    return fixed(name, score, confidence, 0);
  }

  public static ScoringStrategy failing(String name, RuntimeException failure) {
    return new ScoringStrategy() {
      @Override
      public String name() {
        return name;
      }

      @Override
      public EvaluatorResult evaluate(FeatureSet features, EvaluationContext context) {
        throw failure;
      }
    };
  }

  /**
   * Signals {@code started}, then blocks until interrupted, signalling {@code interrupted}.
   */
  public static ScoringStrategy blocking(
      String name, CountDownLatch started, CountDownLatch interrupted) {
    return new ScoringStrategy() {
      @Override
      public String name() {
        return name;
      }

      @Override
      public EvaluatorResult evaluate(FeatureSet features, EvaluationContext context) {
        started.countDown();
        try {
          Thread.sleep(60_000);
        } catch (InterruptedException e) {
          interrupted.countDown();
          Thread.currentThread().interrupt();
        }
        return EvaluatorResult.of(name, 0.5, 0.5, "woke up");
      }
    };
  }
}
