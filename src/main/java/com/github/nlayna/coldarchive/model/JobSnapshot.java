package com.github.nlayna.coldarchive.model;

import java.util.List;

/**
 * Persisted form of every upload and restore record.
 */
public record JobSnapshot(List<UploadJob> uploads, List<RestoreJob> restores) {

    public JobSnapshot {
        uploads = uploads == null ? List.of() : List.copyOf(uploads);
        restores = restores == null ? List.of() : List.copyOf(restores);
    }
}
