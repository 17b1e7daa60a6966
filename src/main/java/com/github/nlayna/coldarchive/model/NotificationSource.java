package com.github.nlayna.coldarchive.model;

public enum NotificationSource {
    UPLOAD,
    RESTORE,
    DOWNLOAD
}
