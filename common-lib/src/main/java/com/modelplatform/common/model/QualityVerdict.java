package com.modelplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Data-quality gate result for one run's dataset snapshot.
 *
 * <p>{@code failedExpectations} keeps the order reported by the quality checker
 * and is empty when {@code passed} is true.
 */
public record QualityVerdict(
    @JsonProperty("passed")             boolean passed,
    @JsonProperty("failedExpectations") List<String> failedExpectations
) {
    public QualityVerdict {
        failedExpectations = failedExpectations == null ? List.of() : List.copyOf(failedExpectations);
    }

    public static QualityVerdict passing() {
        return new QualityVerdict(true, List.of());
    }

    public static QualityVerdict failing(List<String> failedExpectations) {
        return new QualityVerdict(false, failedExpectations);
    }
}
