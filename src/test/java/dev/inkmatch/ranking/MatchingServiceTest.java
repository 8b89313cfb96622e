package dev.inkmatch.ranking;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import dev.inkmatch.candidate.Candidate;
import dev.inkmatch.candidate.CandidateCriteria;
import dev.inkmatch.candidate.CandidatePoolProvider;
import dev.inkmatch.consensus.ConsensusDecision;
import dev.inkmatch.error.InvalidInputException;
import dev.inkmatch.fixture.CandidateBuilder;
import dev.inkmatch.fixture.FeatureSetBuilder;
import dev.inkmatch.fixture.MatchRequestBuilder;
import dev.inkmatch.request.MatchRequest;
import dev.inkmatch.request.RequestContextProvider;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class MatchingServiceTest {

  @Mock RequestContextProvider requestContextProvider;

  @Mock CandidatePoolProvider candidatePoolProvider;

  @Mock RankingPipeline rankingPipeline;

  @Mock MatchExplainer matchExplainer;

  @Captor ArgumentCaptor<List<Candidate>> poolCaptor;

  MatchingService matchingService;

  private final MatchRequest request = new MatchRequestBuilder().id("req-7").build();

  @BeforeEach
  void setUp() {
    matchingService =
        new MatchingService(
            requestContextProvider, candidatePoolProvider, rankingPipeline, matchExplainer);
  }

  private static RankingResult emptyResult(String requestId) {
    return new RankingResult(
        requestId, List.of(), 0, 0, 0, 0, 0, 0, Duration.ZERO, Instant.EPOCH);
  }

  @Test
  void resolves_request_and_pool_then_ranks() {
    List<Candidate> pool = List.of(new CandidateBuilder().id("a").build());
    CandidateCriteria criteria = CandidateCriteria.activeArtists();
    RankingOptions options = RankingOptions.defaults();
    RankingResult expected = emptyResult("req-7");
    when(requestContextProvider.getRequestContext("req-7")).thenReturn(Optional.of(request));
    when(candidatePoolProvider.getCandidatePool(criteria)).thenReturn(pool);
    when(rankingPipeline.rank(request, pool, options)).thenReturn(expected);

    RankingResult result = matchingService.rank("req-7", criteria, options);

    assertThat(result).isSameAs(expected);
  }

  @Test
  void unknown_request_is_invalid_input() {
    when(requestContextProvider.getRequestContext("missing")).thenReturn(Optional.empty());

    assertThatThrownBy(
            () ->
                matchingService.rank(
                    "missing", CandidateCriteria.activeArtists(), RankingOptions.defaults()))
        .isInstanceOf(InvalidInputException.class)
        .hasMessageContaining("missing");
    verifyNoInteractions(candidatePoolProvider, rankingPipeline);
  }

  @Test
  void oversized_pool_is_truncated_to_the_criteria_limit() {
    CandidateCriteria criteria = new CandidateCriteria(true, "japanese", 2);
    List<Candidate> oversized =
        List.of(
            new CandidateBuilder().id("a").build(),
            new CandidateBuilder().id("b").build(),
            new CandidateBuilder().id("c").build());
    when(requestContextProvider.getRequestContext("req-7")).thenReturn(Optional.of(request));
    when(candidatePoolProvider.getCandidatePool(criteria)).thenReturn(oversized);
    when(rankingPipeline.rank(eq(request), any(), any())).thenReturn(emptyResult("req-7"));

    matchingService.rank("req-7", criteria, RankingOptions.defaults());

    verify(rankingPipeline).rank(eq(request), poolCaptor.capture(), any());
    assertThat(poolCaptor.getValue()).extracting(Candidate::id).containsExactly("a", "b");
  }

  @Test
  void explain_delegates_to_the_explainer() {
    RankedMatch match =
        new RankedMatch(
            1,
            new CandidateBuilder().build(),
            new ConsensusDecision(0.7, 0.8, List.of("analytical"), false, 0.0),
            new FeatureSetBuilder().build(),
            List.of(),
            Map.of());
    MatchExplanation explanation = new MatchExplainer().explain(match);
    when(matchExplainer.explain(match)).thenReturn(explanation);

    assertThat(matchingService.explain(match)).isSameAs(explanation);
  }
}
