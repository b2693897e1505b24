package com.modelplatform.common.exception;

import com.modelplatform.common.model.ErrorCode;

import java.util.List;

public class InvalidDataException extends RetrainingException {
    private final List<String> failedExpectations;

    public InvalidDataException(String runId, List<String> failedExpectations) {
        super(ErrorCode.INVALID_DATA, runId,
              "data-quality gate failed, " + failedExpectations.size() + " expectation(s) not met");
        this.failedExpectations = List.copyOf(failedExpectations);
    }

    public List<String> getFailedExpectations() {
        return failedExpectations;
    }
}
