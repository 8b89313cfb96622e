package dev.inkmatch.ranking;

import dev.inkmatch.candidate.Candidate;
import dev.inkmatch.consensus.ConsensusAggregator;
import dev.inkmatch.consensus.ConsensusDecision;
import dev.inkmatch.consensus.NoQuorumException;
import dev.inkmatch.error.InvalidInputException;
import dev.inkmatch.error.RankingCancelledException;
import dev.inkmatch.evaluator.EvaluationContext;
import dev.inkmatch.evaluator.EvaluatorRun;
import dev.inkmatch.evaluator.EvaluatorRunner;
import dev.inkmatch.evaluator.ScoringStrategy;
import dev.inkmatch.feature.FeatureExtractor;
import dev.inkmatch.feature.FeatureSet;
import dev.inkmatch.request.MatchRequest;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ranks a candidate pool against one request.
 *
 * <p>Each candidate is an independent unit on the candidate pool: validate, extract features, run
 * every strategy, aggregate. A unit failing for its own reasons (malformed snapshot, no quorum,
 * unexpected error) is counted and dropped; only an invalid request or cancellation aborts the
 * call. Surviving decisions are filtered to {@code finalScore > minScore}, sorted by final score,
 * then overall confidence, then candidate id, and truncated to top-K.
 *
 * <p>Ranking is all-or-nothing: cancelling a call, through {@link #submit} or by interrupting the
 * thread in {@link #rank}, cancels every in-flight unit and its strategies and yields {@link
 * RankingCancelledException} instead of a partial result.
 */
public class RankingPipeline {

  private static final Logger log = LoggerFactory.getLogger(RankingPipeline.class);

  static final Comparator<RankedMatch> RANKING_ORDER =
      Comparator.comparingDouble((RankedMatch m) -> m.decision().finalScore())
          .reversed()
          .thenComparing(
              Comparator.comparingDouble((RankedMatch m) -> m.decision().overallConfidence())
                  .reversed())
          .thenComparing(m -> m.candidate().id());

  private final FeatureExtractor featureExtractor;
  private final List<ScoringStrategy> strategies;
  private final EvaluatorRunner evaluatorRunner;
  private final ConsensusAggregator aggregator;
  private final ExecutorService candidateExecutor;
  private final ExecutorService callExecutor;
  private final Clock clock;

  public RankingPipeline(
      FeatureExtractor featureExtractor,
      List<ScoringStrategy> strategies,
      EvaluatorRunner evaluatorRunner,
      ConsensusAggregator aggregator,
      ExecutorService candidateExecutor,
      ExecutorService callExecutor,
      Clock clock) {
    if (strategies.isEmpty()) {
      throw new IllegalArgumentException("At least one scoring strategy is required");
    }
    Set<String> names = new HashSet<>();
    for (ScoringStrategy strategy : strategies) {
      if (!names.add(strategy.name())) {
        throw new IllegalArgumentException("Duplicate strategy name: " + strategy.name());
      }
    }
    this.featureExtractor = featureExtractor;
    this.strategies = List.copyOf(strategies);
    this.evaluatorRunner = evaluatorRunner;
    this.aggregator = aggregator;
    this.candidateExecutor = candidateExecutor;
    this.callExecutor = callExecutor;
    this.clock = clock;
  }

  /** Names of the registered strategies, in registration order. */
  public List<String> strategyNames() {
    return strategies.stream().map(ScoringStrategy::name).toList();
  }

  /**
   * Runs {@link #rank} on the call executor.
   *
   * @return a future whose {@code cancel(true)} cancels the whole call
   */
  public Future<RankingResult> submit(
      MatchRequest request, List<Candidate> candidates, RankingOptions options) {
    return callExecutor.submit(() -> rank(request, candidates, options));
  }

  /**
   * @param request the customer request
   * @param candidates the candidate pool snapshot
   * @param options threshold, top-K and strategy timeouts
   * @return ranked top-K matches with coverage counts
   * @throws InvalidInputException if the request is malformed
   * @throws RankingCancelledException if the call is cancelled
   */
  public RankingResult rank(
      MatchRequest request, List<Candidate> candidates, RankingOptions options) {
    InputValidator.validateRequest(request);
    Instant rankedAt = clock.instant();
    long startNanos = System.nanoTime();

    int rejected = 0;
    List<Future<UnitOutcome>> units = new ArrayList<>(candidates.size());
    for (Candidate candidate : candidates) {
      try {
        InputValidator.validateCandidate(candidate);
      } catch (InvalidInputException e) {
        rejected++;
        log.warn(
            "Rejected candidate {} for request {}: {}", candidate.id(), request.id(),
            e.getMessage());
        continue;
      }
      try {
        units.add(candidateExecutor.submit(() -> evaluateCandidate(request, candidate, options)));
      } catch (RejectedExecutionException e) {
        cancelAll(units);
        throw new RankingCancelledException("Candidate executor is not accepting work", e);
      }
    }

    List<RankedMatch> decided = new ArrayList<>(units.size());
    int skipped = 0;
    int failed = 0;
    long timeouts = 0;
    for (int i = 0; i < units.size(); i++) {
      UnitOutcome outcome = join(units, i, request);
      timeouts += outcome.timeouts();
      switch (outcome.status()) {
        case DECIDED -> decided.add(outcome.match());
        case NO_QUORUM -> skipped++;
        case FAILED -> failed++;
      }
    }

    List<RankedMatch> matches = new ArrayList<>();
    int belowThreshold = 0;
    for (RankedMatch match : decided) {
      if (match.decision().finalScore() > options.minScore()) {
        matches.add(match);
      } else {
        belowThreshold++;
      }
    }
    matches.sort(RANKING_ORDER);

    int kept = Math.min(options.topK(), matches.size());
    List<RankedMatch> ranked = new ArrayList<>(kept);
    for (int i = 0; i < kept; i++) {
      ranked.add(matches.get(i).withRank(i + 1));
    }

    Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
    log.info(
        "Ranked request {}: {} considered, {} matched, {} returned, {} skipped (no quorum), "
            + "{} rejected, {} failed, {} below {}, {} strategy timeouts in {}ms",
        request.id(),
        candidates.size(),
        matches.size(),
        ranked.size(),
        skipped,
        rejected,
        failed,
        belowThreshold,
        options.minScore(),
        timeouts,
        elapsed.toMillis());

    return new RankingResult(
        request.id(),
        ranked,
        candidates.size(),
        skipped,
        rejected,
        failed,
        belowThreshold,
        timeouts,
        elapsed,
        rankedAt);
  }

  private UnitOutcome evaluateCandidate(
      MatchRequest request, Candidate candidate, RankingOptions options) {
    EvaluationContext context = new EvaluationContext(request.id(), candidate.id());
    FeatureSet features;
    EvaluatorRun run;
    try {
      features = featureExtractor.extract(request, candidate);
      run = evaluatorRunner.run(strategies, features, context, options.strategyTimeouts());
    } catch (RankingCancelledException e) {
      throw e;
    } catch (RuntimeException e) {
      log.warn("Evaluation failed for candidate {} (request {})", candidate.id(), request.id(), e);
      return new UnitOutcome(Status.FAILED, null, 0);
    }

    try {
      ConsensusDecision decision = aggregator.aggregate(run.results());
      log.debug(
          "Candidate {}: finalScore={}, confidence={}, conflict={}, strategies={}",
          candidate.id(),
          decision.finalScore(),
          decision.overallConfidence(),
          decision.conflict(),
          decision.contributingStrategies());
      // Provisional rank; the final one is assigned after sorting.
      RankedMatch match =
          new RankedMatch(1, candidate, decision, features, run.results(), run.skipped());
      return new UnitOutcome(Status.DECIDED, match, run.timeoutCount());
    } catch (NoQuorumException e) {
      log.warn(
          "Skipped candidate {} for request {}: {} (skipped strategies: {})",
          candidate.id(),
          request.id(),
          e.getMessage(),
          run.skipped());
      return new UnitOutcome(Status.NO_QUORUM, null, run.timeoutCount());
    }
  }

  private static UnitOutcome join(
      List<Future<UnitOutcome>> units, int index, MatchRequest request) {
    try {
      return units.get(index).get();
    } catch (InterruptedException e) {
      cancelAll(units);
      Thread.currentThread().interrupt();
      throw new RankingCancelledException(
          "Ranking of request " + request.id() + " was cancelled", e);
    } catch (ExecutionException e) {
      if (e.getCause() instanceof RankingCancelledException cancelled) {
        cancelAll(units);
        throw cancelled;
      }
      log.warn("Candidate unit failed for request {}", request.id(), e.getCause());
      return new UnitOutcome(Status.FAILED, null, 0);
    }
  }

  private static void cancelAll(List<? extends Future<?>> futures) {
    futures.forEach(f -> f.cancel(true));
  }

  private enum Status {
    DECIDED,
    NO_QUORUM,
    FAILED
  }

  private record UnitOutcome(Status status, @Nullable RankedMatch match, long timeouts) {}
}
