package com.github.nlayna.coldarchive.model;

public record DownloadProgress(
        String key,
        String localPath,
        long downloadedBytes,
        long totalBytes,
        DownloadStatus status,
        String errorMessage) implements ProgressUpdate {

    public static DownloadProgress started(String key, String localPath) {
        return new DownloadProgress(key, localPath, 0, 0, DownloadStatus.DOWNLOADING, null);
    }

    public double getPercentage() {
        if (totalBytes <= 0) {
            return status == DownloadStatus.COMPLETED ? 100.0 : 0.0;
        }
        return (downloadedBytes * 100.0) / totalBytes;
    }

    public DownloadProgress withBytes(long downloaded, long total) {
        return new DownloadProgress(key, localPath, Math.max(downloaded, downloadedBytes), total, status, errorMessage);
    }

    public DownloadProgress completed(long bytes) {
        return new DownloadProgress(key, localPath, bytes, bytes, DownloadStatus.COMPLETED, null);
    }

    public DownloadProgress failed(String error) {
        return new DownloadProgress(key, localPath, downloadedBytes, totalBytes, DownloadStatus.FAILED, error);
    }

    @Override
    public String subject() {
        return key;
    }

    @Override
    public long transferredBytes() {
        return downloadedBytes;
    }
}
