package com.github.nlayna.coldarchive.model;

public enum DownloadStatus {
    DOWNLOADING,
    COMPLETED,
    FAILED
}
