package com.github.nlayna.coldarchive.model;

public enum RestoreStatus {
    IN_PROGRESS,
    COMPLETED,
    FAILED,
    CANCELLED,
    /** Query result for a key that was never requested; never stored on a job. */
    NOT_FOUND;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
