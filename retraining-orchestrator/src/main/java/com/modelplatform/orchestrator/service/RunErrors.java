package com.modelplatform.orchestrator.service;

import com.modelplatform.common.exception.InvalidDataException;
import com.modelplatform.common.exception.RetrainingException;
import com.modelplatform.common.model.ErrorCode;
import com.modelplatform.common.model.RunError;

/**
 * Maps a failure to the sanitised {@link RunError} reported to callers. Messages are
 * fixed per code and never include exception text, hostnames or stack detail.
 */
final class RunErrors {

    private RunErrors() {}

    static RunError from(Throwable error) {
        if (!(error instanceof RetrainingException retraining)) {
            return new RunError(ErrorCode.INTERNAL, "Internal error, see orchestrator logs");
        }
        ErrorCode code = retraining.getCode();
        return new RunError(code, describe(code, retraining));
    }

    private static String describe(ErrorCode code, RetrainingException error) {
        switch (code) {
            case INVALID_DATA:
                int failed = error instanceof InvalidDataException invalid
                    ? invalid.getFailedExpectations().size() : 0;
                return "Data quality gate failed: " + failed + " expectation(s) not met";
            case SIGNAL_SOURCE_FAILURE:
                return "Quality or drift signal unavailable";
            case TRAINING_FAILURE:
                return "Candidate training failed or timed out";
            case LEDGER_CONFLICT:
                return "Promotion ledger head changed during evaluation";
            case LEDGER_STORAGE:
                return "Promotion ledger unavailable";
            case CANCELLED:
                return "Run cancelled";
            case CONCURRENT_RUN_REJECTED:
                return "Another run is active";
            default:
                return "Internal error, see orchestrator logs";
        }
    }
}
