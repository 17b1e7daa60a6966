package com.github.nlayna.coldarchive.model;

public record DownloadResult(long bytesDownloaded, boolean checksumVerified) {
}
