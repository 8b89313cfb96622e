package dev.inkmatch.ranking;

/**
 * One strategy's contribution to a match, for display and audit.
 *
 * @param strategyName the strategy
 * @param score its score
 * @param confidence its confidence
 * @param rationale its account of the score
 * @param elapsedMillis time it took
 * @param countedInConsensus whether the result cleared the confidence floor
 */
public record StrategyBreakdown(
    String strategyName,
    double score,
    double confidence,
    String rationale,
    long elapsedMillis,
    boolean countedInConsensus) {}
