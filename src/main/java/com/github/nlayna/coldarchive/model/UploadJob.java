package com.github.nlayna.coldarchive.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class UploadJob {
    private String id;
    private String filePath;
    private String fileName;
    private long fileSize;
    private String objectKey;
    private Instant createdAt;

    private UploadStatus status;
    private long uploadedBytes;
    private double speedMbps;
    private Long etaSeconds;
    private int retryCount;
    private String errorMessage;
    private Instant startedAt;
    private Instant completedAt;

    private long queueSequence;
    private String multipartUploadId;
    /** Part size the stored multipart upload was cut with. */
    private long partChunkSize;
    private ControlRequest controlRequest;

    public void transitionTo(UploadStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Upload " + id + " cannot move from " + status + " to " + next);
        }
        this.status = next;
    }

    public ControlRequest getControlRequest() {
        return controlRequest == null ? ControlRequest.NONE : controlRequest;
    }

    public double getProgress() {
        if (fileSize <= 0) {
            return status == UploadStatus.COMPLETED ? 100.0 : 0.0;
        }
        return (uploadedBytes * 100.0) / fileSize;
    }

    public String getSpeed() {
        if (speedMbps <= 0) {
            return "N/A";
        }
        return String.format("%.2f MB/s", speedMbps);
    }

    public UploadJob copy() {
        return toBuilder().build();
    }
}
