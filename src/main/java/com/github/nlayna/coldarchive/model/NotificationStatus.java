package com.github.nlayna.coldarchive.model;

public enum NotificationStatus {
    REQUESTED,
    RETRYING,
    PAUSED,
    COMPLETED,
    FAILED,
    CANCELLED,
    EXPIRED
}
