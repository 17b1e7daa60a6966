package com.github.nlayna.coldarchive.service;

import com.github.nlayna.coldarchive.client.ArchiveRestoreState;
import com.github.nlayna.coldarchive.client.ObjectStoreClient;
import com.github.nlayna.coldarchive.config.ArchiveProperties;
import com.github.nlayna.coldarchive.exception.JobOperationException;
import com.github.nlayna.coldarchive.exception.TransferException;
import com.github.nlayna.coldarchive.model.ArchivedObject;
import com.github.nlayna.coldarchive.model.DownloadProgress;
import com.github.nlayna.coldarchive.model.DownloadResult;
import com.github.nlayna.coldarchive.model.DownloadStatus;
import com.github.nlayna.coldarchive.model.Notification;
import com.github.nlayna.coldarchive.model.NotificationSource;
import com.github.nlayna.coldarchive.model.NotificationStatus;
import com.github.nlayna.coldarchive.model.RestoreJob;
import com.github.nlayna.coldarchive.model.RestoreStatus;
import com.github.nlayna.coldarchive.model.RestoreStatusResult;
import com.github.nlayna.coldarchive.model.RestoreTier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.UnaryOperator;

import static com.github.nlayna.coldarchive.exception.JobOperationException.Reason.JOB_NOT_FOUND;
import static com.github.nlayna.coldarchive.exception.JobOperationException.Reason.RESTORE_NOT_AVAILABLE;

/**
 * Tracks restores of archived objects, one active job per key, and downloads restored copies.
 * Restore requests are sent to the object store off the caller's thread; the
 * {@link RestoreStatusPoller} drives submitted jobs to a terminal state.
 */
@Slf4j
@Service
public class RestoreJobService {

    private final JobRecordStore store;
    private final ObjectStoreClient objectStore;
    private final CredentialVerifier credentialVerifier;
    private final RestoredObjectDownloader downloader;
    private final NotificationHub notificationHub;
    private final ArchiveProperties archiveProperties;
    private final Executor restoreScheduler;
    private final Executor downloadExecutor;
    private final Map<String, DownloadProgress> downloads = new ConcurrentHashMap<>();

    public RestoreJobService(JobRecordStore store,
                             ObjectStoreClient objectStore,
                             CredentialVerifier credentialVerifier,
                             RestoredObjectDownloader downloader,
                             NotificationHub notificationHub,
                             ArchiveProperties archiveProperties,
                             @Qualifier("restoreScheduler") Executor restoreScheduler,
                             @Qualifier("downloadExecutor") Executor downloadExecutor) {
        this.store = store;
        this.objectStore = objectStore;
        this.credentialVerifier = credentialVerifier;
        this.downloader = downloader;
        this.notificationHub = notificationHub;
        this.archiveProperties = archiveProperties;
        this.restoreScheduler = restoreScheduler;
        this.downloadExecutor = downloadExecutor;
    }

    /**
     * Returns the active job for {@code key} unchanged if there is one, otherwise records a new job and
     * sends the request in the background.
     */
    public RestoreJob requestRestore(String key, RestoreTier tier) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Object key is required");
        }
        RestoreTier selectedTier = tier == null ? RestoreTier.STANDARD : tier;
        AtomicBoolean created = new AtomicBoolean();

        RestoreJob job = store.atomically(() -> {
            Optional<RestoreJob> existing = store.getRestore(key);
            if (existing.isPresent() && existing.get().getStatus() == RestoreStatus.IN_PROGRESS) {
                return existing.get();
            }
            created.set(true);
            return store.putRestore(RestoreJob.builder()
                    .jobId(UUID.randomUUID().toString())
                    .key(key)
                    .tier(selectedTier)
                    .status(RestoreStatus.IN_PROGRESS)
                    .requestedAt(Instant.now())
                    .build());
        });

        if (created.get()) {
            log.info("Restore {} recorded for {} (tier={})", job.getJobId(), key, selectedTier);
            restoreScheduler.execute(() -> submitRequest(key));
        } else {
            log.info("Restore of {} already in progress as {}", key, job.getJobId());
        }
        return job;
    }

    /**
     * Sends the restore request of an unsubmitted active job. Transient failures leave the job
     * unsubmitted for the next poll tick; permanent ones fail it.
     */
    public void submitRequest(String key) {
        RestoreJob job = store.getRestore(key)
                .filter(j -> j.getStatus() == RestoreStatus.IN_PROGRESS && !j.isSubmitted())
                .orElse(null);
        if (job == null) {
            return;
        }

        int attempts = Math.max(1, archiveProperties.getRestore().getRequestAttempts());
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                credentialVerifier.verify();
                objectStore.requestRestore(key, job.getTier(), archiveProperties.getRestore().getDays());
                markSubmitted(job);
                return;
            } catch (TransferException e) {
                if (!e.isTransient()) {
                    resolve(job, RestoreStatus.FAILED, e.getMessage(), null);
                    return;
                }
                log.warn("Restore request for {} failed (attempt {}/{}): {}", key, attempt, attempts, e.getMessage());
                if (attempt < attempts && !sleepBeforeRetry(attempt)) {
                    return;
                }
            }
        }
    }

    /**
     * Asks the object store about a submitted job and applies the answer.
     */
    public RestoreJob refreshStatus(RestoreJob job) throws TransferException {
        ArchiveRestoreState state = objectStore.getRestoreState(job.getKey());
        return applyExternalState(job, state);
    }

    public RestoreStatusResult checkStatus(String key) throws TransferException {
        Optional<RestoreJob> job = store.getRestore(key);
        if (job.isEmpty()) {
            return RestoreStatusResult.notFound(key);
        }
        RestoreJob current = job.get();
        if (current.getStatus().isTerminal() || !current.isSubmitted()) {
            return RestoreStatusResult.of(current);
        }
        return RestoreStatusResult.of(refreshStatus(current));
    }

    public List<RestoreJob> listJobs() {
        return store.listRestores();
    }

    /**
     * Stops tracking an active restore. The object store offers no way to withdraw a request, so a
     * request already sent keeps running there.
     *
     * @return false if the job is not in progress
     */
    public boolean cancel(String key) {
        Optional<RestoreJob> cancelled = store.atomically(() -> {
            RestoreJob job = store.getRestore(key)
                    .orElseThrow(() -> new JobOperationException(JOB_NOT_FOUND, "Restore not found: " + key));
            if (job.getStatus() != RestoreStatus.IN_PROGRESS) {
                return Optional.<RestoreJob>empty();
            }
            return store.updateRestore(key, j -> {
                j.transitionTo(RestoreStatus.CANCELLED);
                j.setCompletedAt(Instant.now());
            });
        });

        if (cancelled.isEmpty()) {
            log.info("Restore of {} is not in progress, nothing to cancel", key);
            return false;
        }
        log.info("Cancelled restore {} of {}", cancelled.get().getJobId(), key);
        notificationHub.publish(Notification.of(key, NotificationSource.RESTORE, NotificationStatus.CANCELLED,
                "Restore of " + key + " cancelled"));
        return true;
    }

    /**
     * Removes every finished restore job and every finished download record.
     *
     * @return the number of restore jobs removed
     */
    public int clearHistory() {
        int removed = store.removeRestores(j -> j.getStatus().isTerminal());
        downloads.values().removeIf(d -> d.status() != DownloadStatus.DOWNLOADING);
        log.info("Restore history cleared: {} jobs removed", removed);
        return removed;
    }

    /**
     * Starts downloading the restored copy of {@code key}. A download already running for the key is
     * returned instead of starting a second one.
     */
    public DownloadProgress download(String key, String localPath) {
        if (localPath == null || localPath.isBlank()) {
            throw new IllegalArgumentException("Local path is required");
        }
        RestoreJob job = store.getRestore(key)
                .orElseThrow(() -> new JobOperationException(JOB_NOT_FOUND, "Restore not found: " + key));
        if (job.getStatus() != RestoreStatus.COMPLETED) {
            throw new JobOperationException(RESTORE_NOT_AVAILABLE,
                    "Restore of " + key + " is " + job.getStatus() + ", not COMPLETED");
        }

        AtomicBoolean started = new AtomicBoolean();
        DownloadProgress progress = downloads.compute(key, (k, existing) -> {
            if (existing != null && existing.status() == DownloadStatus.DOWNLOADING) {
                return existing;
            }
            started.set(true);
            return DownloadProgress.started(key, localPath);
        });

        if (started.get()) {
            downloadExecutor.execute(() -> runDownload(key, Paths.get(localPath)));
        } else {
            log.info("Download of {} already running to {}", key, progress.localPath());
        }
        return progress;
    }

    public List<DownloadProgress> getDownloads() {
        return List.copyOf(downloads.values());
    }

    public List<ArchivedObject> listArchivedObjects(String prefix) throws TransferException {
        return objectStore.listObjects(prefix == null ? "" : prefix);
    }

    public List<RestoreTier.RestoreTierInfo> tierInfo() {
        return Arrays.stream(RestoreTier.values()).map(RestoreTier::info).toList();
    }

    private void runDownload(String key, Path localPath) {
        long startTime = System.currentTimeMillis();
        try {
            ArchiveRestoreState state = objectStore.getRestoreState(key);
            if (!state.isReadable()) {
                String message = "Restored copy of " + key + " is no longer available";
                log.warn("Download of {} skipped: {}", key, message);
                finishDownload(key, d -> d.failed(message));
                notificationHub.publish(Notification.of(key, NotificationSource.DOWNLOAD, NotificationStatus.EXPIRED, message));
                return;
            }

            DownloadResult result = downloader.download(key, localPath, (downloaded, total) -> {
                DownloadProgress updated = downloads.computeIfPresent(key, (k, d) -> d.withBytes(downloaded, total));
                if (updated != null) {
                    notificationHub.publishProgress(updated);
                }
            });
            finishDownload(key, d -> d.completed(result.bytesDownloaded()));
            log.info("Completed: {} -> {} ({} bytes in {}ms, checksum verified: {})",
                    key, localPath, result.bytesDownloaded(), System.currentTimeMillis() - startTime,
                    result.checksumVerified());
            notificationHub.publish(Notification.of(key, NotificationSource.DOWNLOAD, NotificationStatus.COMPLETED,
                    "Downloaded " + key + " to " + localPath));
        } catch (TransferException | RuntimeException e) {
            log.error("Failed: {} -> {}: {}", key, localPath, e.getMessage());
            finishDownload(key, d -> d.failed(e.getMessage()));
            notificationHub.publish(Notification.of(key, NotificationSource.DOWNLOAD, NotificationStatus.FAILED,
                    e.getMessage()));
        }
    }

    private void finishDownload(String key, UnaryOperator<DownloadProgress> change) {
        DownloadProgress updated = downloads.computeIfPresent(key, (k, d) -> change.apply(d));
        if (updated != null) {
            notificationHub.publishProgress(updated);
        }
    }

    RestoreJob applyExternalState(RestoreJob job, ArchiveRestoreState state) {
        return switch (state.phase()) {
            case IN_PROGRESS -> job;
            case RESTORED, NOT_ARCHIVED -> resolve(job, RestoreStatus.COMPLETED, null, state.expiresAt());
            case NOT_RESTORED -> resolve(job, RestoreStatus.FAILED, "Restore request is no longer active", null);
            case NOT_FOUND -> resolve(job, RestoreStatus.FAILED, "Object not found: " + job.getKey(), null);
        };
    }

    /**
     * Moves the job to a terminal status if it is still the active job for its key. Only the caller
     * that wins this transition notifies.
     */
    private RestoreJob resolve(RestoreJob job, RestoreStatus status, String error, Instant expiresAt) {
        Optional<RestoreJob> resolved = store.atomically(() -> {
            RestoreJob current = store.getRestore(job.getKey()).orElse(null);
            if (current == null || !current.getJobId().equals(job.getJobId())
                    || current.getStatus() != RestoreStatus.IN_PROGRESS) {
                return Optional.<RestoreJob>empty();
            }
            return store.updateRestore(job.getKey(), j -> {
                j.transitionTo(status);
                j.setCompletedAt(Instant.now());
                j.setExpiresAt(expiresAt);
                j.setErrorMessage(error);
            });
        });

        if (resolved.isEmpty()) {
            return store.getRestore(job.getKey()).orElse(job);
        }
        RestoreJob done = resolved.get();
        if (status == RestoreStatus.COMPLETED) {
            log.info("Restore of {} completed, available until {}", done.getKey(), done.getExpiresAt());
            notificationHub.publish(Notification.of(done.getKey(), NotificationSource.RESTORE, NotificationStatus.COMPLETED,
                    "Restore of " + done.getKey() + " completed"));
        } else {
            log.error("Restore of {} failed: {}", done.getKey(), error);
            notificationHub.publish(Notification.of(done.getKey(), NotificationSource.RESTORE, NotificationStatus.FAILED,
                    error));
        }
        return done;
    }

    private void markSubmitted(RestoreJob job) {
        Optional<RestoreJob> submitted = store.atomically(() -> {
            RestoreJob current = store.getRestore(job.getKey()).orElse(null);
            if (current == null || !current.getJobId().equals(job.getJobId())
                    || current.getStatus() != RestoreStatus.IN_PROGRESS) {
                return Optional.<RestoreJob>empty();
            }
            return store.updateRestore(job.getKey(), j -> j.setSubmitted(true));
        });
        submitted.ifPresent(j -> notificationHub.publish(Notification.of(j.getKey(), NotificationSource.RESTORE,
                NotificationStatus.REQUESTED, j.getTier() + " restore of " + j.getKey() + " requested")));
    }

    private static boolean sleepBeforeRetry(int attempt) {
        try {
            Thread.sleep(UploadWorker.backoffMillis(1000, attempt));
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
