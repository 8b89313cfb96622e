package dev.inkmatch.ranking;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Outcome of one ranking call. Coverage counts make degraded results observable.
 *
 * @param requestId the request that was ranked
 * @param matches top-K matches, best first
 * @param candidatesConsidered size of the candidate pool handed in
 * @param candidatesSkipped candidates without quorum (no confident strategy result)
 * @param candidatesRejected candidates with malformed snapshots
 * @param candidatesFailed candidates whose evaluation failed unexpectedly
 * @param candidatesBelowThreshold candidates with a decision at or below the minimum score
 * @param strategyTimeouts strategy runs abandoned on timeout, across all candidates
 * @param elapsed wall time of the call
 * @param rankedAt when the call started
 */
public record RankingResult(
    String requestId,
    List<RankedMatch> matches,
    int candidatesConsidered,
    int candidatesSkipped,
    int candidatesRejected,
    int candidatesFailed,
    int candidatesBelowThreshold,
    long strategyTimeouts,
    Duration elapsed,
    Instant rankedAt) {

  public RankingResult {
    matches = List.copyOf(matches);
  }
}
