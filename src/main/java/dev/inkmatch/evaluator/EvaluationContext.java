package dev.inkmatch.evaluator;

/**
 * Identifies the evaluation unit a strategy is scoring. Strategies must not depend on anything
 * beyond the feature set and this context.
 *
 * @param requestId the customer request
 * @param candidateId the candidate being scored
 */
public record EvaluationContext(String requestId, String candidateId) {}
