package dev.inkmatch.evaluator;

import dev.inkmatch.error.RankingCancelledException;
import dev.inkmatch.feature.FeatureSet;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a set of strategies concurrently against one feature set, each raced against its own
 * timeout.
 *
 * <p>All strategies are submitted at once. The runner waits for completions up to the nearest
 * outstanding deadline and cancels, with interrupt, every strategy whose own deadline has passed.
 * A cancelled strategy is abandoned: if it finishes later its result is never read. The call
 * therefore never blocks much beyond the largest configured timeout, and a slow or failing
 * strategy only removes itself from the returned {@link EvaluatorRun}.
 *
 * <p>Interrupting the calling thread cancels every in-flight strategy and raises {@link
 * RankingCancelledException}.
 */
public class EvaluatorRunner {

  private static final Logger log = LoggerFactory.getLogger(EvaluatorRunner.class);

  private static final Duration MAX_NANOS = Duration.ofNanos(Long.MAX_VALUE);

  private final ExecutorService strategyExecutor;

  public EvaluatorRunner(ExecutorService strategyExecutor) {
    this.strategyExecutor = strategyExecutor;
  }

  public EvaluatorRun run(
      List<? extends ScoringStrategy> strategies,
      FeatureSet features,
      EvaluationContext context,
      Duration perStrategyTimeout) {
    return run(strategies, features, context, StrategyTimeouts.uniform(perStrategyTimeout));
  }

  /**
   * @param strategies strategies to run; names must be unique
   * @param features signals for the candidate
   * @param context the evaluation unit
   * @param timeouts per-strategy limits
   * @return completed results in completion order plus the strategies that were skipped
   * @throws RankingCancelledException if the calling thread is interrupted while waiting
   */
  public EvaluatorRun run(
      List<? extends ScoringStrategy> strategies,
      FeatureSet features,
      EvaluationContext context,
      StrategyTimeouts timeouts) {
    CompletionService<EvaluatorResult> completions =
        new ExecutorCompletionService<>(strategyExecutor);
    Map<Future<EvaluatorResult>, Pending> pending = new IdentityHashMap<>();

    for (ScoringStrategy strategy : strategies) {
      long timeoutNanos = saturatedNanos(timeouts.timeoutFor(strategy.name()));
      long startNanos = System.nanoTime();
      try {
        Future<EvaluatorResult> future =
            completions.submit(() -> evaluateTimed(strategy, features, context));
        pending.put(future, new Pending(strategy.name(), startNanos, timeoutNanos));
      } catch (RejectedExecutionException e) {
        cancelAll(pending);
        throw new RankingCancelledException("Strategy executor is not accepting work", e);
      }
    }

    List<EvaluatorResult> results = new ArrayList<>(strategies.size());
    Map<String, StrategyFailure> skipped = new HashMap<>();

    try {
      while (!pending.isEmpty()) {
        long waitNanos = expireOverdue(pending, skipped, context);
        if (pending.isEmpty()) {
          break;
        }
        Future<EvaluatorResult> done = completions.poll(waitNanos, TimeUnit.NANOSECONDS);
        if (done == null) {
          continue;
        }
        Pending entry = pending.remove(done);
        if (entry == null) {
          // Cancelled on timeout; already recorded.
          continue;
        }
        collect(done, entry, results, skipped, context);
      }
    } catch (InterruptedException e) {
      cancelAll(pending);
      Thread.currentThread().interrupt();
      throw new RankingCancelledException(
          "Evaluation of candidate " + context.candidateId() + " was cancelled", e);
    }

    return new EvaluatorRun(results, skipped);
  }

  private static EvaluatorResult evaluateTimed(
      ScoringStrategy strategy, FeatureSet features, EvaluationContext context) {
    long start = System.nanoTime();
    EvaluatorResult result = strategy.evaluate(features, context);
    if (result == null) {
      return null;
    }
    return result.withElapsed(Duration.ofNanos(System.nanoTime() - start));
  }

  /** Cancels strategies past their deadline and returns the wait until the nearest one. */
  private static long expireOverdue(
      Map<Future<EvaluatorResult>, Pending> pending,
      Map<String, StrategyFailure> skipped,
      EvaluationContext context) {
    long now = System.nanoTime();
    long nearestWait = Long.MAX_VALUE;
    Iterator<Map.Entry<Future<EvaluatorResult>, Pending>> it = pending.entrySet().iterator();
    while (it.hasNext()) {
      Map.Entry<Future<EvaluatorResult>, Pending> entry = it.next();
      Pending p = entry.getValue();
      long remaining = p.remainingNanos(now);
      if (remaining <= 0) {
        // cancel() fails only when the task already completed; its future is queued for poll().
        if (entry.getKey().cancel(true)) {
          it.remove();
          skipped.put(p.strategyName(), StrategyFailure.TIMEOUT);
          log.warn(
              "Strategy '{}' timed out for candidate {} (request {})",
              p.strategyName(),
              context.candidateId(),
              context.requestId());
          continue;
        }
      }
      nearestWait = Math.min(nearestWait, Math.max(0L, remaining));
    }
    return nearestWait;
  }

  private static void collect(
      Future<EvaluatorResult> done,
      Pending entry,
      List<EvaluatorResult> results,
      Map<String, StrategyFailure> skipped,
      EvaluationContext context)
      throws InterruptedException {
    EvaluatorResult result;
    try {
      result = done.get();
    } catch (ExecutionException e) {
      skipped.put(entry.strategyName(), StrategyFailure.ERROR);
      log.warn(
          "Strategy '{}' failed for candidate {}: {}",
          entry.strategyName(),
          context.candidateId(),
          e.getCause() == null ? e.getMessage() : e.getCause().toString());
      return;
    }
    if (result == null || !entry.strategyName().equals(result.strategyName())) {
      skipped.put(entry.strategyName(), StrategyFailure.INVALID_RESULT);
      log.warn(
          "Strategy '{}' returned an invalid result for candidate {}",
          entry.strategyName(),
          context.candidateId());
      return;
    }
    log.debug(
        "Strategy '{}' scored candidate {}: score={}, confidence={}, elapsed={}ms",
        result.strategyName(),
        context.candidateId(),
        result.score(),
        result.confidence(),
        result.elapsed().toMillis());
    results.add(result);
  }

  private static void cancelAll(Map<Future<EvaluatorResult>, Pending> pending) {
    pending.keySet().forEach(f -> f.cancel(true));
    pending.clear();
  }

  /** Durations past the nanosecond range wait for {@code Long.MAX_VALUE} nanoseconds. */
  static long saturatedNanos(Duration timeout) {
    return timeout.compareTo(MAX_NANOS) >= 0 ? Long.MAX_VALUE : timeout.toNanos();
  }

  // Compared as elapsed time so that no absolute deadline can overflow.
  private record Pending(String strategyName, long startNanos, long timeoutNanos) {

    long remainingNanos(long now) {
      return timeoutNanos - (now - startNanos);
    }
  }
}
