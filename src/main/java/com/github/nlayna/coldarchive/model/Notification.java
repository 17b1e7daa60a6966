package com.github.nlayna.coldarchive.model;

import java.time.Instant;

/**
 * Immutable record of a noteworthy job transition. {@code subject} is the upload job id
 * or the object key of a restore/download.
 */
public record Notification(
        String subject,
        NotificationSource source,
        NotificationStatus status,
        String message,
        Instant timestamp) {

    public static Notification of(String subject, NotificationSource source, NotificationStatus status, String message) {
        return new Notification(subject, source, status, message, Instant.now());
    }
}
