package com.github.nlayna.coldarchive.service;

import com.github.nlayna.coldarchive.client.CompletedPartRef;
import com.github.nlayna.coldarchive.client.ObjectStoreClient;
import com.github.nlayna.coldarchive.client.PartSource;
import com.github.nlayna.coldarchive.exception.ObjectNotFoundException;
import com.github.nlayna.coldarchive.exception.PermanentTransferException;
import com.github.nlayna.coldarchive.exception.TransferException;
import com.github.nlayna.coldarchive.exception.TransientTransferException;
import com.github.nlayna.coldarchive.model.ControlRequest;
import com.github.nlayna.coldarchive.model.Notification;
import com.github.nlayna.coldarchive.model.NotificationSource;
import com.github.nlayna.coldarchive.model.NotificationStatus;
import com.github.nlayna.coldarchive.model.PartPlan;
import com.github.nlayna.coldarchive.model.PartRange;
import com.github.nlayna.coldarchive.model.UploadConfig;
import com.github.nlayna.coldarchive.model.UploadJob;
import com.github.nlayna.coldarchive.model.UploadProgress;
import com.github.nlayna.coldarchive.model.UploadStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs one upload job from IN_PROGRESS to its next resting state. Parts of a job are sent on the
 * part executor, at most {@code maxConcurrentParts} at a time; pause and cancel requests are
 * honoured between parts, after the parts already in flight have settled.
 */
@Slf4j
@Component
public class UploadWorker {

    private static final long MAX_BACKOFF_MS = 30_000;

    public enum Outcome {
        COMPLETED,
        FAILED,
        CANCELLED,
        PAUSED,
        /** Interrupted; the job went back to the queue. */
        REQUEUED
    }

    @FunctionalInterface
    private interface TransferCall<T> {
        T execute() throws TransferException;
    }

    private final ObjectStoreClient objectStore;
    private final CredentialVerifier credentialVerifier;
    private final JobRecordStore store;
    private final NotificationHub notificationHub;

    public UploadWorker(ObjectStoreClient objectStore,
                        CredentialVerifier credentialVerifier,
                        JobRecordStore store,
                        NotificationHub notificationHub) {
        this.objectStore = objectStore;
        this.credentialVerifier = credentialVerifier;
        this.store = store;
        this.notificationHub = notificationHub;
    }

    public Outcome execute(String jobId, UploadConfig config, Executor partExecutor) {
        UploadJob job = store.getUpload(jobId).orElse(null);
        if (job == null || job.getStatus() != UploadStatus.IN_PROGRESS) {
            log.warn("Upload {} is not in progress, skipping", jobId);
            return Outcome.CANCELLED;
        }
        log.info("Uploading: {} -> {} ({} bytes)", job.getFilePath(), job.getObjectKey(), job.getFileSize());

        try {
            credentialVerifier.verify();
            Path file = checkSource(job);
            PartPlan plan;
            try {
                plan = PartPlanner.plan(job.getFileSize(), config);
            } catch (IllegalArgumentException e) {
                throw new PermanentTransferException(e.getMessage(), e);
            }
            BandwidthLimiter limiter = config.getBandwidthLimitMbps() == null
                    ? null : BandwidthLimiter.ofMbps(config.getBandwidthLimitMbps());

            if (plan.isMultipart()) {
                return uploadMultipart(job, file, plan, config, limiter, partExecutor);
            }
            return uploadSingle(job, file, plan, config, limiter);
        } catch (TransferException e) {
            return fail(jobId, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return requeue(jobId);
        } catch (RuntimeException e) {
            log.error("Unexpected error uploading {}", jobId, e);
            return fail(jobId, e.getMessage() != null ? e.getMessage() : e.getClass().getName());
        }
    }

    private Outcome uploadSingle(UploadJob job, Path file, PartPlan plan, UploadConfig config,
                                 BandwidthLimiter limiter) throws TransferException, InterruptedException {
        Outcome interrupted = checkControl(job.getId(), job.getObjectKey(), null, config);
        if (interrupted != null) {
            return interrupted;
        }
        resetProgress(job.getId(), 0);

        PartRange part = plan.parts().get(0);
        long startNanos = System.nanoTime();
        withRetry(job.getId(), config, "put object", () -> {
            objectStore.putObject(job.getObjectKey(), PartSource.of(file, part, limiter), config.timeout());
            return null;
        });
        reportProgress(job.getId(), part.length(), 0, startNanos);
        return complete(job.getId(), startNanos);
    }

    private Outcome uploadMultipart(UploadJob job, Path file, PartPlan plan, UploadConfig config,
                                    BandwidthLimiter limiter, Executor partExecutor)
            throws TransferException, InterruptedException {
        String jobId = job.getId();
        String key = job.getObjectKey();
        Duration timeout = config.timeout();
        Map<Integer, CompletedPartRef> confirmed = new ConcurrentHashMap<>();

        String uploadId = job.getMultipartUploadId();
        if (uploadId != null) {
            if (!config.isEnableResume()) {
                abortQuietly(key, uploadId, timeout);
                uploadId = null;
            } else if (job.getPartChunkSize() != plan.chunkSize()) {
                // stored parts sit at offsets of the old part size
                log.warn("Part size of upload {} changed from {} to {} bytes, restarting from zero",
                        jobId, job.getPartChunkSize(), plan.chunkSize());
                abortQuietly(key, uploadId, timeout);
                store.updateUpload(jobId, j -> j.setMultipartUploadId(null));
                uploadId = null;
            } else {
                uploadId = collectConfirmedParts(jobId, key, uploadId, plan, config, confirmed);
            }
        }

        Outcome interrupted = checkControl(jobId, key, uploadId, config);
        if (interrupted != null) {
            return interrupted;
        }

        if (uploadId == null) {
            String createdId = withRetry(jobId, config, "initiate multipart upload",
                    () -> objectStore.initiateMultipartUpload(key, timeout));
            store.updateUpload(jobId, j -> {
                j.setMultipartUploadId(createdId);
                j.setPartChunkSize(plan.chunkSize());
            });
            uploadId = createdId;
        }

        long baseBytes = confirmed.values().stream().mapToLong(CompletedPartRef::size).sum();
        resetProgress(jobId, baseBytes);
        if (!confirmed.isEmpty()) {
            log.info("Resuming upload {} with {} of {} parts already stored", jobId, confirmed.size(), plan.parts().size());
        }

        String activeUploadId = uploadId;
        long startNanos = System.nanoTime();
        Semaphore permits = new Semaphore(config.getMaxConcurrentParts());
        AtomicReference<TransferException> failure = new AtomicReference<>();
        List<CompletableFuture<Void>> inFlight = new ArrayList<>();

        try {
            for (PartRange part : plan.parts()) {
                if (confirmed.containsKey(part.partNumber())) {
                    continue;
                }
                if (failure.get() != null || controlRequest(jobId) != ControlRequest.NONE) {
                    break;
                }
                permits.acquire();
                if (failure.get() != null || controlRequest(jobId) != ControlRequest.NONE) {
                    permits.release();
                    break;
                }
                inFlight.add(CompletableFuture.runAsync(() -> {
                    try {
                        String eTag = withRetry(jobId, config, "upload part " + part.partNumber(),
                                () -> objectStore.uploadPart(key, activeUploadId, part.partNumber(),
                                        PartSource.of(file, part, limiter), timeout));
                        confirmed.put(part.partNumber(), new CompletedPartRef(part.partNumber(), eTag, part.length()));
                        log.debug("Upload {} part {}/{} stored ({} bytes)",
                                jobId, part.partNumber(), plan.parts().size(), part.length());
                        reportProgress(jobId, part.length(), baseBytes, startNanos);
                    } catch (TransferException e) {
                        failure.compareAndSet(null, e);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        failure.compareAndSet(null, new TransientTransferException("Upload interrupted", e));
                    } finally {
                        permits.release();
                    }
                }, partExecutor));
            }
        } finally {
            CompletableFuture.allOf(inFlight.toArray(new CompletableFuture[0])).join();
        }

        TransferException error = failure.get();
        if (error != null) {
            if (!(config.isEnableResume() && error.isTransient())) {
                abortQuietly(key, activeUploadId, timeout);
                store.updateUpload(jobId, j -> j.setMultipartUploadId(null));
            }
            return fail(jobId, error.getMessage());
        }

        if (controlRequest(jobId) == ControlRequest.CANCEL) {
            abortQuietly(key, activeUploadId, timeout);
            return cancelled(jobId);
        }

        if (confirmed.size() == plan.parts().size()) {
            List<CompletedPartRef> parts = new ArrayList<>(confirmed.values());
            parts.sort(Comparator.comparingInt(CompletedPartRef::partNumber));
            withRetry(jobId, config, "complete multipart upload", () -> {
                objectStore.completeMultipartUpload(key, activeUploadId, parts, timeout);
                return null;
            });
            return complete(jobId, startNanos);
        }

        return paused(jobId, key, activeUploadId, config);
    }

    /**
     * Fills {@code confirmed} with the parts the store already holds.
     *
     * @return the upload id to continue with, or null when the stored upload is gone
     */
    private String collectConfirmedParts(String jobId, String key, String uploadId, PartPlan plan,
                                         UploadConfig config, Map<Integer, CompletedPartRef> confirmed)
            throws TransferException, InterruptedException {
        try {
            List<CompletedPartRef> stored = withRetry(jobId, config, "list parts",
                    () -> objectStore.listUploadedParts(key, uploadId, config.timeout()));
            for (CompletedPartRef ref : stored) {
                PartRange planned = plan.part(ref.partNumber());
                if (planned != null && planned.length() == ref.size()) {
                    confirmed.put(ref.partNumber(), ref);
                }
            }
            return uploadId;
        } catch (ObjectNotFoundException e) {
            log.warn("Multipart upload {} for {} no longer exists, restarting from zero", uploadId, key);
            store.updateUpload(jobId, j -> j.setMultipartUploadId(null));
            return null;
        }
    }

    private <T> T withRetry(String jobId, UploadConfig config, String operation, TransferCall<T> call)
            throws TransferException, InterruptedException {
        int attempt = 0;
        while (true) {
            try {
                return call.execute();
            } catch (TransferException e) {
                if (!e.isTransient() || !store.consumeUploadRetry(jobId, config.getRetryAttempts(), e.getMessage())) {
                    throw e;
                }
                attempt++;
                long delay = backoffMillis(config.getRetryBaseDelayMs(), attempt);
                log.warn("Retrying {} for upload {} in {}ms (attempt {}): {}", operation, jobId, delay, attempt, e.getMessage());
                notificationHub.publish(Notification.of(jobId, NotificationSource.UPLOAD, NotificationStatus.RETRYING,
                        "Retrying " + operation + ": " + e.getMessage()));
                Thread.sleep(delay);
            }
        }
    }

    static long backoffMillis(long baseDelayMs, int attempt) {
        if (baseDelayMs <= 0) {
            return 0;
        }
        int exponent = Math.min(attempt - 1, 20);
        return Math.min(MAX_BACKOFF_MS, baseDelayMs * (1L << exponent));
    }

    private Path checkSource(UploadJob job) throws PermanentTransferException {
        Path file = Paths.get(job.getFilePath());
        try {
            if (!Files.isRegularFile(file)) {
                throw new PermanentTransferException("Source file does not exist: " + job.getFilePath());
            }
            long size = Files.size(file);
            if (size != job.getFileSize()) {
                throw new PermanentTransferException(String.format(
                        "Source file changed since submission: %s (expected %d bytes, found %d)",
                        job.getFilePath(), job.getFileSize(), size));
            }
            return file;
        } catch (IOException e) {
            throw new PermanentTransferException(e.getMessage(), e);
        }
    }

    /**
     * @return the outcome to stop with when a pause or cancel is pending, otherwise null
     */
    private Outcome checkControl(String jobId, String key, String uploadId, UploadConfig config) {
        ControlRequest control = controlRequest(jobId);
        if (control == ControlRequest.CANCEL) {
            if (uploadId != null) {
                abortQuietly(key, uploadId, config.timeout());
            }
            return cancelled(jobId);
        }
        if (control == ControlRequest.PAUSE) {
            return paused(jobId, key, uploadId, config);
        }
        return null;
    }

    private ControlRequest controlRequest(String jobId) {
        return store.getUpload(jobId).map(UploadJob::getControlRequest).orElse(ControlRequest.CANCEL);
    }

    private void resetProgress(String jobId, long confirmedBytes) {
        store.updateUpload(jobId, j -> {
            j.setUploadedBytes(confirmedBytes);
            j.setSpeedMbps(0);
            j.setEtaSeconds(null);
        });
    }

    private void reportProgress(String jobId, long partBytes, long baseBytes, long startNanos) {
        store.atomically(() -> {
            store.updateUpload(jobId, j -> {
                long uploaded = Math.min(j.getFileSize(), j.getUploadedBytes() + partBytes);
                j.setUploadedBytes(uploaded);
                double elapsedSeconds = (System.nanoTime() - startNanos) / 1_000_000_000.0;
                double speed = elapsedSeconds > 0 ? (uploaded - baseBytes) / (double) UploadConfig.MIB / elapsedSeconds : 0;
                j.setSpeedMbps(speed);
                j.setEtaSeconds(speed > 0
                        ? (long) Math.ceil((j.getFileSize() - uploaded) / (double) UploadConfig.MIB / speed)
                        : null);
            }).ifPresent(updated -> notificationHub.publishProgress(UploadProgress.of(updated)));
            return null;
        });
    }

    private Outcome complete(String jobId, long startNanos) {
        long durationMs = (System.nanoTime() - startNanos) / 1_000_000;
        store.updateUpload(jobId, j -> {
            j.transitionTo(UploadStatus.COMPLETED);
            j.setUploadedBytes(j.getFileSize());
            j.setEtaSeconds(0L);
            j.setErrorMessage(null);
            j.setCompletedAt(Instant.now());
            j.setMultipartUploadId(null);
            j.setControlRequest(ControlRequest.NONE);
        }).ifPresent(j -> {
            log.info("Completed: {} -> {} ({} bytes in {}ms, speed: {})",
                    j.getFilePath(), j.getObjectKey(), j.getFileSize(), durationMs, j.getSpeed());
            notificationHub.publishProgress(UploadProgress.of(j));
            notificationHub.publish(Notification.of(jobId, NotificationSource.UPLOAD, NotificationStatus.COMPLETED,
                    "Uploaded " + j.getFileName() + " to " + j.getObjectKey()));
        });
        return Outcome.COMPLETED;
    }

    private Outcome fail(String jobId, String error) {
        store.updateUpload(jobId, j -> {
            j.transitionTo(UploadStatus.FAILED);
            j.setErrorMessage(error);
            j.setSpeedMbps(0);
            j.setEtaSeconds(null);
            j.setControlRequest(ControlRequest.NONE);
        }).ifPresent(j -> {
            log.error("Failed: {} -> {}: {}", j.getFilePath(), j.getObjectKey(), error);
            notificationHub.publish(Notification.of(jobId, NotificationSource.UPLOAD, NotificationStatus.FAILED, error));
        });
        return Outcome.FAILED;
    }

    private Outcome cancelled(String jobId) {
        store.updateUpload(jobId, j -> {
            j.transitionTo(UploadStatus.CANCELLED);
            j.setCompletedAt(Instant.now());
            j.setSpeedMbps(0);
            j.setEtaSeconds(null);
            j.setMultipartUploadId(null);
            j.setControlRequest(ControlRequest.NONE);
        }).ifPresent(j -> {
            log.info("Cancelled upload {} ({})", jobId, j.getFileName());
            notificationHub.publish(Notification.of(jobId, NotificationSource.UPLOAD, NotificationStatus.CANCELLED,
                    "Upload of " + j.getFileName() + " cancelled"));
        });
        return Outcome.CANCELLED;
    }

    /**
     * Keeps the multipart upload for a later resume when resume is enabled, aborts it otherwise.
     */
    private Outcome paused(String jobId, String key, String uploadId, UploadConfig config) {
        if (uploadId != null && !config.isEnableResume()) {
            abortQuietly(key, uploadId, config.timeout());
        }
        store.updateUpload(jobId, j -> {
            j.transitionTo(UploadStatus.PAUSED);
            j.setSpeedMbps(0);
            j.setEtaSeconds(null);
            j.setControlRequest(ControlRequest.NONE);
            if (!config.isEnableResume()) {
                j.setMultipartUploadId(null);
            }
        }).ifPresent(j -> {
            log.info("Paused upload {} at {} of {} bytes", jobId, j.getUploadedBytes(), j.getFileSize());
            notificationHub.publish(Notification.of(jobId, NotificationSource.UPLOAD, NotificationStatus.PAUSED,
                    "Upload of " + j.getFileName() + " paused"));
        });
        return Outcome.PAUSED;
    }

    private Outcome requeue(String jobId) {
        long sequence = store.nextQueueSequence();
        store.updateUpload(jobId, j -> {
            j.transitionTo(UploadStatus.PENDING);
            j.setQueueSequence(sequence);
            j.setSpeedMbps(0);
            j.setEtaSeconds(null);
            j.setControlRequest(ControlRequest.NONE);
        });
        log.warn("Upload {} interrupted, returned to the queue", jobId);
        return Outcome.REQUEUED;
    }

    private void abortQuietly(String key, String uploadId, Duration timeout) {
        try {
            objectStore.abortMultipartUpload(key, uploadId, timeout);
        } catch (TransferException e) {
            log.warn("Failed to abort multipart upload {} for {}: {}", uploadId, key, e.getMessage());
        }
    }
}
