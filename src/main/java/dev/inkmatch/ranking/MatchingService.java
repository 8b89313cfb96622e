package dev.inkmatch.ranking;

import dev.inkmatch.candidate.Candidate;
import dev.inkmatch.candidate.CandidateCriteria;
import dev.inkmatch.candidate.CandidatePoolProvider;
import dev.inkmatch.error.InvalidInputException;
import dev.inkmatch.request.MatchRequest;
import dev.inkmatch.request.RequestContextProvider;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Id-based entry point: resolves the request from intake, fetches a candidate pool snapshot from
 * the directory, and ranks it.
 *
 * <p>Created by the host application once it supplies the two collaborators.
 */
public class MatchingService {

  private static final Logger log = LoggerFactory.getLogger(MatchingService.class);

  private final RequestContextProvider requestContextProvider;
  private final CandidatePoolProvider candidatePoolProvider;
  private final RankingPipeline rankingPipeline;
  private final MatchExplainer matchExplainer;

  public MatchingService(
      RequestContextProvider requestContextProvider,
      CandidatePoolProvider candidatePoolProvider,
      RankingPipeline rankingPipeline,
      MatchExplainer matchExplainer) {
    this.requestContextProvider = requestContextProvider;
    this.candidatePoolProvider = candidatePoolProvider;
    this.rankingPipeline = rankingPipeline;
    this.matchExplainer = matchExplainer;
  }

  /**
   * @throws InvalidInputException if intake knows no request with this id, or it is malformed
   */
  public RankingResult rank(String requestId, CandidateCriteria criteria, RankingOptions options) {
    MatchRequest request =
        requestContextProvider
            .getRequestContext(requestId)
            .orElseThrow(
                () -> new InvalidInputException(requestId, "Unknown request: " + requestId));
    List<Candidate> pool = candidatePoolProvider.getCandidatePool(criteria);
    if (pool.size() > criteria.limit()) {
      log.warn(
          "Directory returned {} candidates for a limit of {}; truncating",
          pool.size(),
          criteria.limit());
      pool = pool.subList(0, criteria.limit());
    }
    log.debug("Ranking request {} against a pool of {}", requestId, pool.size());
    return rankingPipeline.rank(request, pool, options);
  }

  public MatchExplanation explain(RankedMatch match) {
    return matchExplainer.explain(match);
  }
}
