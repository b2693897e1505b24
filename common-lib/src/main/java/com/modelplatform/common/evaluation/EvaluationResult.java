package com.modelplatform.common.evaluation;

/**
 * Verdict of {@link PromotionEvaluator}. {@code reason} is a short human-readable
 * explanation for logs.
 */
public record EvaluationResult(boolean accepted, String reason) {

    static EvaluationResult accept(String reason) {
        return new EvaluationResult(true, reason);
    }

    static EvaluationResult reject(String reason) {
        return new EvaluationResult(false, reason);
    }
}
