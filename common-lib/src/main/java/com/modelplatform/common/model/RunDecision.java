package com.modelplatform.common.model;

/**
 * The externally visible result of a run. Every run ends in exactly one of these.
 */
public enum RunDecision {
    SKIPPED,
    TRAINED_NOT_PROMOTED,
    PROMOTED,
    FAILED,
    REJECTED
}
