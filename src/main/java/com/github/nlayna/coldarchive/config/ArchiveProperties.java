package com.github.nlayna.coldarchive.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Data
@Component
@ConfigurationProperties(prefix = "archive")
public class ArchiveProperties {
    private String bucket;
    private String region = "us-east-1";
    private String endpoint;
    private boolean pathStyleAccess;
    private String accessKeyId;
    private String secretAccessKey;
    private String keyPrefix = "uploads";
    private String storageClass = "DEEP_ARCHIVE";
    private int notificationHistorySize = 200;
    /** Per-call timeout for listing, restore requests and restore-state checks. */
    private Duration requestTimeout = Duration.ofSeconds(60);
    private Restore restore = new Restore();
    private Download download = new Download();
    private Persistence persistence = new Persistence();

    @Data
    public static class Restore {
        private int days = 7;
        private Duration pollInterval = Duration.ofSeconds(30);
        private int requestAttempts = 3;
    }

    @Data
    public static class Download {
        private int threadPoolSize = 4;
        private boolean checksumEnabled = true;
        private Duration timeout = Duration.ofHours(1);
    }

    @Data
    public static class Persistence {
        private boolean enabled;
        private String path = "./data/jobs.json";
        private long flushIntervalMs = 5000;
    }
}
