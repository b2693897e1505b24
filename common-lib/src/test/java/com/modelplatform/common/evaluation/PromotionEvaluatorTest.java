package com.modelplatform.common.evaluation;

import com.modelplatform.common.model.Candidate;
import com.modelplatform.common.model.PromotionRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Deterministic verification of {@link PromotionEvaluator}: strict improvement,
 * the epsilon boundary, the eligibility floor and the no-model case.
 */
class PromotionEvaluatorTest {

    private static Candidate candidate(double metric) {
        return Candidate.of("run-1", "s3://models/run-1", metric, Instant.now());
    }

    private static PromotionRecord current(double metric) {
        return new PromotionRecord("p-0", "sentiment-v1", 1L, "s3://models/run-0",
                                   metric, Instant.now(), "run-0");
    }

    // ── improvement rule ─────────────────────────────────────────────────

    @Nested
    @DisplayName("evaluate() — improvement over current model")
    class ImprovementTests {

        private final PromotionEvaluator evaluator = new PromotionEvaluator(0.01, 0.0);

        @Test
        @DisplayName("0.80 vs current 0.80, epsilon 0.01 → reject")
        void equalMetric_rejected() {
            assertFalse(evaluator.evaluate(candidate(0.80), current(0.80)).accepted());
        }

        @Test
        @DisplayName("0.82 vs current 0.80, epsilon 0.01 → accept")
        void clearImprovement_accepted() {
            assertTrue(evaluator.evaluate(candidate(0.82), current(0.80)).accepted());
        }

        @Test
        @DisplayName("improvement smaller than epsilon → reject")
        void improvementBelowEpsilon_rejected() {
            assertFalse(evaluator.evaluate(candidate(0.805), current(0.80)).accepted());
        }

        @Test
        @DisplayName("worse candidate → reject")
        void worseCandidate_rejected() {
            EvaluationResult result = evaluator.evaluate(candidate(0.60), current(0.80));
            assertFalse(result.accepted());
            assertTrue(result.reason().contains("does not exceed"));
        }
    }

    @Nested
    @DisplayName("evaluate() — boundary")
    class BoundaryTests {

        @Test
        @DisplayName("candidate exactly current + epsilon → reject (strict inequality)")
        void exactlyAtThreshold_rejected() {
            // 0.5 + 0.25 is exact in binary floating point
            PromotionEvaluator evaluator = new PromotionEvaluator(0.25, 0.0);
            assertFalse(evaluator.evaluate(candidate(0.75), current(0.5)).accepted());
        }

        @Test
        @DisplayName("epsilon 0 → ties rejected, any strict gain accepted")
        void zeroEpsilon_strictlyGreater() {
            PromotionEvaluator evaluator = PromotionEvaluator.strict(0.0);
            assertFalse(evaluator.evaluate(candidate(0.9), current(0.9)).accepted());
            assertTrue(evaluator.evaluate(candidate(Math.nextUp(0.9)), current(0.9)).accepted());
        }

        @Test
        @DisplayName("NaN candidate metric → reject")
        void nanMetric_rejected() {
            PromotionEvaluator evaluator = PromotionEvaluator.strict(0.0);
            assertFalse(evaluator.evaluate(candidate(Double.NaN), PromotionRecord.NONE).accepted());
        }

        @Test
        @DisplayName("infinite candidate metric → reject")
        void infiniteMetric_rejected() {
            PromotionEvaluator evaluator = PromotionEvaluator.strict(0.0);
            assertFalse(evaluator.evaluate(candidate(Double.POSITIVE_INFINITY), current(0.5)).accepted());
        }
    }

    @Nested
    @DisplayName("evaluate() — eligibility and first promotion")
    class EligibilityTests {

        private final PromotionEvaluator evaluator = new PromotionEvaluator(0.0, 0.75);

        @Test
        @DisplayName("no model of record, eligible candidate → accept")
        void noCurrentModel_accepted() {
            assertTrue(evaluator.evaluate(candidate(0.76), PromotionRecord.NONE).accepted());
        }

        @Test
        @DisplayName("no model of record, candidate below floor → reject")
        void noCurrentModel_belowFloor_rejected() {
            assertFalse(evaluator.evaluate(candidate(0.70), PromotionRecord.NONE).accepted());
        }

        @Test
        @DisplayName("candidate beats weak current model but is below floor → reject")
        void beatsCurrentButBelowFloor_rejected() {
            EvaluationResult result = evaluator.evaluate(candidate(0.70), current(0.60));
            assertFalse(result.accepted());
            assertTrue(result.reason().contains("eligibility floor"));
        }

        @Test
        @DisplayName("candidate exactly at floor is eligible")
        void atFloor_eligible() {
            assertTrue(evaluator.evaluate(candidate(0.75), PromotionRecord.NONE).accepted());
        }
    }

    @Test
    @DisplayName("negative epsilon is refused")
    void negativeEpsilon_throws() {
        assertThrows(IllegalArgumentException.class, () -> new PromotionEvaluator(-0.01, 0.0));
    }
}
