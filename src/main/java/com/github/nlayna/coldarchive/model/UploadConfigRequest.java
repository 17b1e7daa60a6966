package com.github.nlayna.coldarchive.model;

import lombok.Data;

/**
 * A tier plus optional overrides. Fields left null keep the tier's defaults.
 */
@Data
public class UploadConfigRequest {
    private UploadTier tier = UploadTier.FREE;
    private Integer maxConcurrentUploads;
    private Integer maxConcurrentParts;
    private Long chunkSizeMb;
    private Long minChunkSizeMb;
    private Long maxChunkSizeMb;
    private Boolean adaptiveChunkSize;
    private Integer retryAttempts;
    private Long timeoutSeconds;
    private Double bandwidthLimitMbps;
    private Boolean enableResume;
    private Long retryBaseDelayMs;

    public UploadConfig toUploadConfig() {
        UploadConfig config = UploadConfig.forTier(tier == null ? UploadTier.FREE : tier);
        if (maxConcurrentUploads != null) {
            config.setMaxConcurrentUploads(maxConcurrentUploads);
        }
        if (maxConcurrentParts != null) {
            config.setMaxConcurrentParts(maxConcurrentParts);
        }
        if (chunkSizeMb != null) {
            config.setChunkSizeMb(chunkSizeMb);
        }
        if (minChunkSizeMb != null) {
            config.setMinChunkSizeMb(minChunkSizeMb);
        }
        if (maxChunkSizeMb != null) {
            config.setMaxChunkSizeMb(maxChunkSizeMb);
        }
        if (adaptiveChunkSize != null) {
            config.setAdaptiveChunkSize(adaptiveChunkSize);
        }
        if (retryAttempts != null) {
            config.setRetryAttempts(retryAttempts);
        }
        if (timeoutSeconds != null) {
            config.setTimeoutSeconds(timeoutSeconds);
        }
        if (enableResume != null) {
            config.setEnableResume(enableResume);
        }
        if (retryBaseDelayMs != null) {
            config.setRetryBaseDelayMs(retryBaseDelayMs);
        }
        config.setBandwidthLimitMbps(bandwidthLimitMbps);
        return config;
    }
}
