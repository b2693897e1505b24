package com.modelplatform.common.model;

/**
 * Error taxonomy of the retraining pipeline. These codes are safe to return to
 * remote callers; exception detail stays in the logs.
 */
public enum ErrorCode {
    /** Another run holds the single-flight lock. Caller may resubmit later. */
    CONCURRENT_RUN_REJECTED,
    /** The data-quality gate failed. Needs an upstream data fix. */
    INVALID_DATA,
    /** The quality or drift signal could not be obtained. */
    SIGNAL_SOURCE_FAILURE,
    /** The trainer failed or timed out. Not retried within the run. */
    TRAINING_FAILURE,
    /** The ledger head moved between evaluation and commit. */
    LEDGER_CONFLICT,
    /** The ledger could not be read or written. */
    LEDGER_STORAGE,
    /** Every deployment-notification attempt failed. Never fails a run. */
    NOTIFICATION_EXHAUSTED,
    /** The run was aborted through its cancellation token. */
    CANCELLED,
    INTERNAL
}
