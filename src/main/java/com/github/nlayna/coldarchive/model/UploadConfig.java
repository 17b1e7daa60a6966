package com.github.nlayna.coldarchive.model;

import com.github.nlayna.coldarchive.exception.JobOperationException;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/**
 * Queue-wide transfer settings, installed when the upload queue is initialised.
 * Field defaults are the free tier's.
 */
@Data
@NoArgsConstructor
public class UploadConfig {

    public static final long MIB = 1024L * 1024L;

    private UploadTier tier = UploadTier.FREE;
    private int maxConcurrentUploads = 1;
    private int maxConcurrentParts = 1;
    private long chunkSizeMb = 5;
    private long minChunkSizeMb = 5;
    private long maxChunkSizeMb = 5;
    private boolean adaptiveChunkSize;
    private int retryAttempts = 3;
    private long timeoutSeconds = 600;
    private Double bandwidthLimitMbps;
    private boolean enableResume;
    private long retryBaseDelayMs = 1000;

    public static UploadConfig forTier(UploadTier tier) {
        UploadConfig config = new UploadConfig();
        config.setTier(tier);
        if (tier == UploadTier.PREMIUM) {
            config.setMaxConcurrentUploads(8);
            config.setMaxConcurrentParts(8);
            config.setChunkSizeMb(10);
            config.setMinChunkSizeMb(5);
            config.setMaxChunkSizeMb(100);
            config.setAdaptiveChunkSize(true);
            config.setRetryAttempts(10);
            config.setTimeoutSeconds(1800);
            config.setEnableResume(true);
        }
        return config;
    }

    public UploadConfig copy() {
        UploadConfig copy = new UploadConfig();
        copy.setTier(tier);
        copy.setMaxConcurrentUploads(maxConcurrentUploads);
        copy.setMaxConcurrentParts(maxConcurrentParts);
        copy.setChunkSizeMb(chunkSizeMb);
        copy.setMinChunkSizeMb(minChunkSizeMb);
        copy.setMaxChunkSizeMb(maxChunkSizeMb);
        copy.setAdaptiveChunkSize(adaptiveChunkSize);
        copy.setRetryAttempts(retryAttempts);
        copy.setTimeoutSeconds(timeoutSeconds);
        copy.setBandwidthLimitMbps(bandwidthLimitMbps);
        copy.setEnableResume(enableResume);
        copy.setRetryBaseDelayMs(retryBaseDelayMs);
        return copy;
    }

    public Duration timeout() {
        return Duration.ofSeconds(timeoutSeconds);
    }

    public void validate() {
        require(tier != null, "tier is required");
        require(maxConcurrentUploads > 0, "maxConcurrentUploads must be positive");
        require(maxConcurrentParts > 0, "maxConcurrentParts must be positive");
        require(minChunkSizeMb > 0, "minChunkSizeMb must be positive");
        require(minChunkSizeMb <= chunkSizeMb && chunkSizeMb <= maxChunkSizeMb,
                "chunk sizes must satisfy minChunkSizeMb <= chunkSizeMb <= maxChunkSizeMb");
        require(retryAttempts >= 0, "retryAttempts must not be negative");
        require(timeoutSeconds > 0, "timeoutSeconds must be positive");
        require(retryBaseDelayMs >= 0, "retryBaseDelayMs must not be negative");
        require(bandwidthLimitMbps == null || bandwidthLimitMbps > 0, "bandwidthLimitMbps must be positive");

        if (tier == UploadTier.FREE) {
            require(maxConcurrentUploads == 1, "Free tier uploads one file at a time");
            require(maxConcurrentParts == 1, "Free tier uploads one part at a time");
            require(!adaptiveChunkSize, "Free tier does not support adaptive chunk sizes");
            require(chunkSizeMb == 5 && minChunkSizeMb == 5 && maxChunkSizeMb == 5,
                    "Free tier chunk size is fixed at 5 MB");
        }
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new JobOperationException(JobOperationException.Reason.INVALID_CONFIG, message);
        }
    }
}
