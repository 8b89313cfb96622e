package dev.inkmatch.api;

import dev.inkmatch.config.MatchingProperties;
import dev.inkmatch.evaluator.StrategyTimeouts;
import dev.inkmatch.ranking.MatchExplainer;
import dev.inkmatch.ranking.MatchExplanation;
import dev.inkmatch.ranking.RankedMatch;
import dev.inkmatch.ranking.RankingOptions;
import dev.inkmatch.ranking.RankingPipeline;
import dev.inkmatch.ranking.RankingResult;
import java.time.Duration;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST adapter over the ranking engine. Errors are rendered by the global exception handler. */
@RestController
@RequestMapping("/api/matches")
public class MatchController {

  private final RankingPipeline rankingPipeline;
  private final MatchExplainer matchExplainer;
  private final MatchingProperties properties;

  public MatchController(
      RankingPipeline rankingPipeline,
      MatchExplainer matchExplainer,
      MatchingProperties properties) {
    this.rankingPipeline = rankingPipeline;
    this.matchExplainer = matchExplainer;
    this.properties = properties;
  }

  /** Ranks the supplied candidate pool against the request. */
  @PostMapping
  public RankingResult rank(@RequestBody RankMatchesRequest body) {
    return rankingPipeline.rank(body.request(), body.candidates(), optionsFor(body));
  }

  /** Breaks a previously returned match down per strategy. */
  @PostMapping("/explain")
  public MatchExplanation explain(@RequestBody RankedMatch match) {
    return matchExplainer.explain(match);
  }

  RankingOptions optionsFor(RankMatchesRequest body) {
    RankingOptions defaults = properties.defaultOptions();
    StrategyTimeouts timeouts =
        body.strategyTimeoutMs() == null
            ? defaults.strategyTimeouts()
            : StrategyTimeouts.uniform(Duration.ofMillis(body.strategyTimeoutMs()));
    return new RankingOptions(
        body.minScore() == null ? defaults.minScore() : body.minScore(),
        body.topK() == null ? defaults.topK() : body.topK(),
        timeouts);
  }
}
