package com.github.nlayna.coldarchive.client;

import java.time.Instant;

/**
 * What the object store reports about the restored copy of an archived object.
 */
public record ArchiveRestoreState(Phase phase, Instant expiresAt) {

    public enum Phase {
        /** A restore request is running. */
        IN_PROGRESS,
        /** A temporary copy is readable until {@code expiresAt}. */
        RESTORED,
        /** The object is archived with no active request or readable copy. */
        NOT_RESTORED,
        /** The object is in a storage class that is readable without a restore. */
        NOT_ARCHIVED,
        NOT_FOUND
    }

    public static ArchiveRestoreState of(Phase phase) {
        return new ArchiveRestoreState(phase, null);
    }

    public boolean isReadable() {
        return phase == Phase.RESTORED || phase == Phase.NOT_ARCHIVED;
    }
}
