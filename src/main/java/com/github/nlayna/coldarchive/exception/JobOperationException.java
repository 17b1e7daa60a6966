package com.github.nlayna.coldarchive.exception;

import lombok.Getter;

/**
 * Precondition violation rejected at the queue or tracker boundary before any state changes.
 */
@Getter
public class JobOperationException extends RuntimeException {

    public enum Reason {
        JOB_NOT_FOUND,
        DUPLICATE_SUBMISSION,
        JOB_ACTIVE,
        INVALID_STATE,
        FILE_NOT_FOUND,
        INVALID_CONFIG,
        RESTORE_NOT_AVAILABLE
    }

    private final Reason reason;

    public JobOperationException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }
}
