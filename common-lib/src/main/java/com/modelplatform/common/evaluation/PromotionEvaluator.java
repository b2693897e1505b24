package com.modelplatform.common.evaluation;

import com.modelplatform.common.model.Candidate;
import com.modelplatform.common.model.PromotionRecord;

/**
 * Deterministic promotion rule: a candidate replaces the model of record only on
 * strict improvement beyond a minimum threshold.
 *
 * <ol>
 *   <li>Non-finite metrics are rejected.</li>
 *   <li>Metrics below {@code minimumMetric} are ineligible, whatever the current model scores.</li>
 *   <li>With no model of record, an eligible candidate is accepted.</li>
 *   <li>Otherwise accept iff {@code candidate > current + epsilon}. Equality rejects.</li>
 * </ol>
 *
 * <p>Pure: no I/O, no state, no logging.
 */
public final class PromotionEvaluator {

    private final double epsilon;
    private final double minimumMetric;

    public PromotionEvaluator(double epsilon, double minimumMetric) {
        if (epsilon < 0 || !Double.isFinite(epsilon)) {
            throw new IllegalArgumentException("epsilon must be a finite value >= 0, was " + epsilon);
        }
        if (!Double.isFinite(minimumMetric)) {
            throw new IllegalArgumentException("minimumMetric must be finite, was " + minimumMetric);
        }
        this.epsilon = epsilon;
        this.minimumMetric = minimumMetric;
    }

    /** Strict-improvement rule with no eligibility floor. */
    public static PromotionEvaluator strict(double epsilon) {
        return new PromotionEvaluator(epsilon, -Double.MAX_VALUE);
    }

    public EvaluationResult evaluate(Candidate candidate, PromotionRecord current) {
        double score = candidate.metricValue();
        if (!Double.isFinite(score)) {
            return EvaluationResult.reject("candidate metric is not finite: " + score);
        }
        if (score < minimumMetric) {
            return EvaluationResult.reject(String.format(
                "candidate metric %.4f below eligibility floor %.4f", score, minimumMetric));
        }
        if (current.isNone() || current.metricValue() == null) {
            return EvaluationResult.accept(String.format(
                "no model of record, candidate metric %.4f is eligible", score));
        }
        double threshold = current.metricValue() + epsilon;
        if (score > threshold) {
            return EvaluationResult.accept(String.format(
                "candidate %.4f > current %.4f + epsilon %.4f", score, current.metricValue(), epsilon));
        }
        return EvaluationResult.reject(String.format(
            "candidate %.4f does not exceed current %.4f + epsilon %.4f", score, current.metricValue(), epsilon));
    }
}
