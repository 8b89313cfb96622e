package dev.inkmatch.config;

import dev.inkmatch.consensus.ConsensusAggregator;
import dev.inkmatch.evaluator.EvaluatorRunner;
import dev.inkmatch.evaluator.ScoringStrategy;
import dev.inkmatch.feature.FeatureExtractor;
import dev.inkmatch.ranking.MatchExplainer;
import dev.inkmatch.ranking.RankingPipeline;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

/**
 * Wires the matching engine. Strategies are picked up as {@link ScoringStrategy} beans.
 *
 * <p>Candidate units and strategies run on separate pools so a unit waiting on its strategies
 * never holds a thread its strategies need.
 */
@Configuration
public class EngineConfig {

  private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

  @Bean(name = "strategyExecutor", destroyMethod = "shutdownNow")
  public ExecutorService strategyExecutor(MatchingProperties properties) {
    return Executors.newFixedThreadPool(
        properties.getStrategyPoolSize(), daemonThreads("inkmatch-strategy-"));
  }

  @Bean(name = "candidateExecutor", destroyMethod = "shutdownNow")
  public ExecutorService candidateExecutor(MatchingProperties properties) {
    return Executors.newFixedThreadPool(
        properties.getCandidateParallelism(), daemonThreads("inkmatch-candidate-"));
  }

  @Bean(name = "rankingCallExecutor", destroyMethod = "shutdownNow")
  public ExecutorService rankingCallExecutor() {
    return Executors.newCachedThreadPool(daemonThreads("inkmatch-rank-"));
  }

  @Bean
  public FeatureExtractor featureExtractor(MatchingProperties properties) {
    return new FeatureExtractor(properties.getDistanceProfile());
  }

  @Bean
  public EvaluatorRunner evaluatorRunner(
      @Qualifier("strategyExecutor") ExecutorService strategyExecutor) {
    return new EvaluatorRunner(strategyExecutor);
  }

  @Bean
  public ConsensusAggregator consensusAggregator(MatchingProperties properties) {
    return new ConsensusAggregator(
        properties.getConfidenceFloor(), properties.getConflictThreshold());
  }

  @Bean
  public RankingPipeline rankingPipeline(
      FeatureExtractor featureExtractor,
      List<ScoringStrategy> strategies,
      EvaluatorRunner evaluatorRunner,
      ConsensusAggregator consensusAggregator,
      @Qualifier("candidateExecutor") ExecutorService candidateExecutor,
      @Qualifier("rankingCallExecutor") ExecutorService rankingCallExecutor,
      Clock clock) {
    RankingPipeline pipeline =
        new RankingPipeline(
            featureExtractor,
            strategies,
            evaluatorRunner,
            consensusAggregator,
            candidateExecutor,
            rankingCallExecutor,
            clock);
    log.info("Matching engine ready with strategies {}", pipeline.strategyNames());
    return pipeline;
  }

  @Bean
  public MatchExplainer matchExplainer() {
    return new MatchExplainer();
  }

  private static CustomizableThreadFactory daemonThreads(String prefix) {
    CustomizableThreadFactory factory = new CustomizableThreadFactory(prefix);
    factory.setDaemon(true);
    return factory;
  }
}
