package com.github.nlayna.coldarchive.model;

import java.util.EnumSet;
import java.util.Set;

public enum UploadStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETED,
    FAILED,
    PAUSED,
    CANCELLED;

    /**
     * Allowed status edges. IN_PROGRESS -> PENDING exists only for jobs that are
     * re-queued after an interrupted worker or a restart.
     */
    public boolean canTransitionTo(UploadStatus next) {
        return allowedTransitions().contains(next);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }

    private Set<UploadStatus> allowedTransitions() {
        return switch (this) {
            case PENDING -> EnumSet.of(IN_PROGRESS, PAUSED, CANCELLED);
            case IN_PROGRESS -> EnumSet.of(COMPLETED, FAILED, PAUSED, CANCELLED, PENDING);
            case FAILED -> EnumSet.of(PENDING, CANCELLED);
            case PAUSED -> EnumSet.of(PENDING, CANCELLED);
            case COMPLETED, CANCELLED -> EnumSet.noneOf(UploadStatus.class);
        };
    }
}
