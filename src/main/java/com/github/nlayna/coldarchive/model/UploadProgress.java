package com.github.nlayna.coldarchive.model;

public record UploadProgress(
        String jobId,
        long uploadedBytes,
        long totalBytes,
        double percentage,
        double speedMbps,
        Long etaSeconds,
        UploadStatus status) implements ProgressUpdate {

    public static UploadProgress of(UploadJob job) {
        return new UploadProgress(job.getId(), job.getUploadedBytes(), job.getFileSize(),
                job.getProgress(), job.getSpeedMbps(), job.getEtaSeconds(), job.getStatus());
    }

    @Override
    public String subject() {
        return jobId;
    }

    @Override
    public long transferredBytes() {
        return uploadedBytes;
    }
}
