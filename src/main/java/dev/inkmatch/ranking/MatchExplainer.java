package dev.inkmatch.ranking;

import dev.inkmatch.consensus.ConsensusDecision;
import dev.inkmatch.evaluator.EvaluatorResult;
import java.util.Comparator;
import java.util.List;

/** Turns a {@link RankedMatch} into a side-effect-free {@link MatchExplanation}. */
public class MatchExplainer {

  public MatchExplanation explain(RankedMatch match) {
    ConsensusDecision decision = match.decision();
    List<StrategyBreakdown> breakdown =
        match.evaluations().stream()
            .sorted(Comparator.comparing(EvaluatorResult::strategyName))
            .map(
                result ->
                    new StrategyBreakdown(
                        result.strategyName(),
                        result.score(),
                        result.confidence(),
                        result.rationale(),
                        result.elapsed().toMillis(),
                        decision.contributedBy(result.strategyName())))
            .toList();

    return new MatchExplanation(
        match.candidate().id(),
        match.rank(),
        decision.finalScore(),
        decision.overallConfidence(),
        breakdown,
        match.skippedStrategies(),
        decision.conflict(),
        decision.conflictMagnitude(),
        match.features());
  }
}
