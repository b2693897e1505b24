package com.modelplatform.common.exception;

import com.modelplatform.common.model.ErrorCode;

public class LedgerStorageException extends RetrainingException {

    public LedgerStorageException(String runId, String message, Throwable cause) {
        super(ErrorCode.LEDGER_STORAGE, runId, message, cause);
    }
}
