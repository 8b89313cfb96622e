package dev.inkmatch.api;

import dev.inkmatch.candidate.Candidate;
import dev.inkmatch.request.MatchRequest;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Body of {@code POST /api/matches}. Unset options fall back to the configured defaults.
 *
 * @param request the customer request
 * @param candidates candidate pool snapshot
 * @param minScore minimum score override
 * @param topK result size override
 * @param strategyTimeoutMs uniform per-strategy timeout override, in milliseconds
 */
public record RankMatchesRequest(
    MatchRequest request,
    List<Candidate> candidates,
    @Nullable Double minScore,
    @Nullable Integer topK,
    @Nullable Long strategyTimeoutMs) {

  public RankMatchesRequest {
    if (request == null) {
      throw new IllegalArgumentException("request must not be null");
    }
    candidates = candidates == null ? List.of() : List.copyOf(candidates);
  }
}
