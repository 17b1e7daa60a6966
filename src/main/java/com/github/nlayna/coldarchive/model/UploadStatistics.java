package com.github.nlayna.coldarchive.model;

public record UploadStatistics(
        long totalFiles,
        long pendingFiles,
        long inProgressFiles,
        long completedFiles,
        long failedFiles,
        long pausedFiles,
        long cancelledFiles,
        long totalBytes,
        long uploadedBytes,
        double averageSpeedMbps,
        Long estimatedTimeRemaining) {
}
