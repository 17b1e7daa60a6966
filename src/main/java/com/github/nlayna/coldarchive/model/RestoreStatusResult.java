package com.github.nlayna.coldarchive.model;

import java.time.Instant;

public record RestoreStatusResult(
        String key,
        boolean restored,
        RestoreStatus status,
        Instant expiresAt,
        String errorMessage) {

    public static RestoreStatusResult notFound(String key) {
        return new RestoreStatusResult(key, false, RestoreStatus.NOT_FOUND, null, null);
    }

    public static RestoreStatusResult of(RestoreJob job) {
        return new RestoreStatusResult(job.getKey(), job.getStatus() == RestoreStatus.COMPLETED,
                job.getStatus(), job.getExpiresAt(), job.getErrorMessage());
    }
}
