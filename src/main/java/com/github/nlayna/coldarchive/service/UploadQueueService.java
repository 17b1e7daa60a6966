package com.github.nlayna.coldarchive.service;

import com.github.nlayna.coldarchive.config.AsyncConfig;
import com.github.nlayna.coldarchive.config.UploadProperties;
import com.github.nlayna.coldarchive.exception.JobOperationException;
import com.github.nlayna.coldarchive.model.ControlRequest;
import com.github.nlayna.coldarchive.model.KeyNamingOptions;
import com.github.nlayna.coldarchive.model.Notification;
import com.github.nlayna.coldarchive.model.NotificationSource;
import com.github.nlayna.coldarchive.model.NotificationStatus;
import com.github.nlayna.coldarchive.model.SubmissionResult;
import com.github.nlayna.coldarchive.model.UploadConfig;
import com.github.nlayna.coldarchive.model.UploadJob;
import com.github.nlayna.coldarchive.model.UploadStatistics;
import com.github.nlayna.coldarchive.model.UploadStatus;
import com.github.nlayna.coldarchive.model.UploadSubmission;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

import static com.github.nlayna.coldarchive.exception.JobOperationException.Reason.DUPLICATE_SUBMISSION;
import static com.github.nlayna.coldarchive.exception.JobOperationException.Reason.FILE_NOT_FOUND;
import static com.github.nlayna.coldarchive.exception.JobOperationException.Reason.INVALID_STATE;
import static com.github.nlayna.coldarchive.exception.JobOperationException.Reason.JOB_ACTIVE;
import static com.github.nlayna.coldarchive.exception.JobOperationException.Reason.JOB_NOT_FOUND;

/**
 * Accepts files for upload and feeds pending jobs to the upload pool in submission order.
 * Every operation here only reads or changes job records; transfers run on the pool.
 */
@Slf4j
@Service
public class UploadQueueService {

    private final JobRecordStore store;
    private final UploadWorker uploadWorker;
    private final ObjectKeyGenerator keyGenerator;
    private final NotificationHub notificationHub;
    private final Object dispatchLock = new Object();

    private volatile UploadConfig config;
    private volatile boolean processing;
    private ThreadPoolTaskExecutor uploadExecutor;
    private ThreadPoolTaskExecutor partExecutor;

    public UploadQueueService(JobRecordStore store,
                              UploadWorker uploadWorker,
                              ObjectKeyGenerator keyGenerator,
                              NotificationHub notificationHub,
                              UploadProperties uploadProperties) {
        this.store = store;
        this.uploadWorker = uploadWorker;
        this.keyGenerator = keyGenerator;
        this.notificationHub = notificationHub;
        UploadConfig initial = uploadProperties.toUploadConfig();
        initial.validate();
        this.config = initial;
        createExecutors(initial);
        log.info("Upload queue configured: tier={}, maxConcurrentUploads={}, maxConcurrentParts={}",
                initial.getTier(), initial.getMaxConcurrentUploads(), initial.getMaxConcurrentParts());
    }

    /**
     * Installs a new configuration. Only allowed while processing is stopped and no job is in progress.
     */
    public UploadConfig initialize(UploadConfig newConfig) {
        newConfig.validate();
        synchronized (dispatchLock) {
            if (processing) {
                throw new JobOperationException(INVALID_STATE, "Stop processing before changing the upload configuration");
            }
            if (!store.findUploads(j -> j.getStatus() == UploadStatus.IN_PROGRESS).isEmpty()) {
                throw new JobOperationException(JOB_ACTIVE, "Uploads are still in progress");
            }
            shutdownExecutors();
            config = newConfig.copy();
            createExecutors(config);
        }
        log.info("Upload queue initialized: tier={}, maxConcurrentUploads={}, maxConcurrentParts={}, chunk={}MB",
                newConfig.getTier(), newConfig.getMaxConcurrentUploads(), newConfig.getMaxConcurrentParts(),
                newConfig.getChunkSizeMb());
        return getConfig();
    }

    public UploadConfig getConfig() {
        return config.copy();
    }

    public boolean isProcessing() {
        return processing;
    }

    public UploadJob submitFile(String filePath, KeyNamingOptions keyOptions) {
        if (filePath == null || filePath.isBlank()) {
            throw new JobOperationException(FILE_NOT_FOUND, "File path is required");
        }
        Path file = Paths.get(filePath).toAbsolutePath().normalize();
        if (!Files.exists(file)) {
            throw new JobOperationException(FILE_NOT_FOUND, "File not found: " + file);
        }
        if (!Files.isRegularFile(file)) {
            throw new JobOperationException(FILE_NOT_FOUND, "Not a regular file: " + file);
        }
        long size;
        try {
            size = Files.size(file);
        } catch (IOException e) {
            throw new JobOperationException(FILE_NOT_FOUND, "Cannot read file size of " + file + ": " + e.getMessage());
        }
        String normalizedPath = file.toString();
        String objectKey = keyGenerator.generate(file, keyOptions);

        UploadJob job = store.atomically(() -> {
            boolean duplicate = !store.findUploads(j -> j.getFilePath().equals(normalizedPath)
                    && (j.getStatus() == UploadStatus.PENDING || j.getStatus() == UploadStatus.IN_PROGRESS)).isEmpty();
            if (duplicate) {
                throw new JobOperationException(DUPLICATE_SUBMISSION, "File is already queued: " + normalizedPath);
            }
            return store.insertUpload(UploadJob.builder()
                    .id(UUID.randomUUID().toString())
                    .filePath(normalizedPath)
                    .fileName(file.getFileName().toString())
                    .fileSize(size)
                    .objectKey(objectKey)
                    .createdAt(Instant.now())
                    .status(UploadStatus.PENDING)
                    .queueSequence(store.nextQueueSequence())
                    .controlRequest(ControlRequest.NONE)
                    .build());
        });

        log.info("Upload {} submitted: {} -> {} ({} bytes)", job.getId(), normalizedPath, objectKey, size);
        dispatch();
        return job;
    }

    /**
     * Submits every path independently; a rejected path does not stop the others.
     */
    public SubmissionResult submitFiles(UploadSubmission submission) {
        List<UploadJob> accepted = new ArrayList<>();
        List<SubmissionResult.Rejection> rejected = new ArrayList<>();
        List<String> paths = submission.getFilePaths() == null ? List.of() : submission.getFilePaths();
        for (String path : paths) {
            try {
                accepted.add(submitFile(path, submission.getKeyOptions()));
            } catch (JobOperationException e) {
                log.warn("Rejected {}: {}", path, e.getMessage());
                rejected.add(new SubmissionResult.Rejection(path, e.getReason(), e.getMessage()));
            }
        }
        log.info("Batch submitted: accepted={}, rejected={}", accepted.size(), rejected.size());
        return new SubmissionResult(accepted, rejected);
    }

    public UploadJob getJob(String jobId) {
        return store.getUpload(jobId)
                .orElseThrow(() -> new JobOperationException(JOB_NOT_FOUND, "Upload not found: " + jobId));
    }

    public List<UploadJob> getJobs() {
        return store.listUploads();
    }

    public void removeJob(String jobId) {
        store.atomically(() -> {
            UploadJob job = getJob(jobId);
            if (job.getStatus() == UploadStatus.IN_PROGRESS) {
                throw new JobOperationException(JOB_ACTIVE, "Upload " + jobId + " is in progress; cancel it first");
            }
            return store.removeUploads(j -> j.getId().equals(jobId));
        });
        log.info("Upload {} removed", jobId);
    }

    /**
     * Cancels a job. A job in progress stops after its in-flight parts settle.
     */
    public UploadJob cancel(String jobId) {
        UploadJob job = store.atomically(() -> {
            UploadJob current = getJob(jobId);
            if (current.getStatus().isTerminal()) {
                throw new JobOperationException(INVALID_STATE, "Upload " + jobId + " is already " + current.getStatus());
            }
            if (current.getStatus() == UploadStatus.IN_PROGRESS) {
                return update(jobId, j -> j.setControlRequest(ControlRequest.CANCEL));
            }
            return update(jobId, j -> {
                j.transitionTo(UploadStatus.CANCELLED);
                j.setCompletedAt(Instant.now());
            });
        });

        if (job.getStatus() == UploadStatus.CANCELLED) {
            log.info("Cancelled upload {} ({})", jobId, job.getFileName());
            notificationHub.publish(Notification.of(jobId, NotificationSource.UPLOAD, NotificationStatus.CANCELLED,
                    "Upload of " + job.getFileName() + " cancelled"));
        } else {
            log.info("Cancel requested for active upload {}", jobId);
        }
        return job;
    }

    public UploadJob pause(String jobId) {
        UploadJob job = store.atomically(() -> {
            UploadJob current = getJob(jobId);
            if (current.getStatus() == UploadStatus.IN_PROGRESS && current.getControlRequest() != ControlRequest.CANCEL) {
                return update(jobId, j -> j.setControlRequest(ControlRequest.PAUSE));
            }
            if (current.getStatus() != UploadStatus.PENDING) {
                throw new JobOperationException(INVALID_STATE, "Upload " + jobId + " cannot be paused while "
                        + current.getStatus());
            }
            return update(jobId, j -> j.transitionTo(UploadStatus.PAUSED));
        });

        if (job.getStatus() == UploadStatus.PAUSED) {
            log.info("Paused upload {}", jobId);
            notificationHub.publish(Notification.of(jobId, NotificationSource.UPLOAD, NotificationStatus.PAUSED,
                    "Upload of " + job.getFileName() + " paused"));
        } else {
            log.info("Pause requested for active upload {}", jobId);
        }
        return job;
    }

    /**
     * Returns a paused job to the back of the queue, or withdraws a pause that has not taken effect yet.
     */
    public UploadJob resume(String jobId) {
        UploadJob job = store.atomically(() -> {
            UploadJob current = getJob(jobId);
            if (current.getStatus() == UploadStatus.IN_PROGRESS && current.getControlRequest() == ControlRequest.PAUSE) {
                return update(jobId, j -> j.setControlRequest(ControlRequest.NONE));
            }
            if (current.getStatus() != UploadStatus.PAUSED) {
                throw new JobOperationException(INVALID_STATE, "Upload " + jobId + " is not paused");
            }
            return requeue(jobId);
        });
        log.info("Resumed upload {}", jobId);
        dispatch();
        return job;
    }

    /**
     * User-triggered retry of a failed job: the retry budget starts over and the job joins the back of the queue.
     */
    public UploadJob retry(String jobId) {
        UploadJob job = store.atomically(() -> {
            UploadJob current = getJob(jobId);
            if (current.getStatus() != UploadStatus.FAILED) {
                throw new JobOperationException(INVALID_STATE, "Upload " + jobId + " is not failed");
            }
            requeue(jobId);
            return update(jobId, j -> {
                j.setRetryCount(0);
                j.setErrorMessage(null);
            });
        });
        log.info("Retry scheduled for upload {}", jobId);
        dispatch();
        return job;
    }

    /**
     * Starts dispatching. Paused jobs, including those paused by {@link #stop()}, rejoin the queue.
     */
    public void start() {
        synchronized (dispatchLock) {
            processing = true;
        }
        int requeued = store.atomically(() -> {
            List<UploadJob> paused = new ArrayList<>(store.findUploads(j -> j.getStatus() == UploadStatus.PAUSED));
            paused.sort(Comparator.comparingLong(UploadJob::getQueueSequence));
            paused.forEach(j -> requeue(j.getId()));
            store.findUploads(j -> j.getStatus() == UploadStatus.IN_PROGRESS
                            && j.getControlRequest() == ControlRequest.PAUSE)
                    .forEach(j -> update(j.getId(), u -> u.setControlRequest(ControlRequest.NONE)));
            return paused.size();
        });
        log.info("Upload processing started ({} paused jobs re-queued)", requeued);
        dispatch();
    }

    /**
     * Stops dispatching. Active jobs pause after their in-flight parts; pending jobs stay queued.
     */
    public int stop() {
        synchronized (dispatchLock) {
            processing = false;
        }
        int signalled = store.atomically(() -> {
            List<UploadJob> active = store.findUploads(j -> j.getStatus() == UploadStatus.IN_PROGRESS
                    && j.getControlRequest() == ControlRequest.NONE);
            active.forEach(j -> update(j.getId(), u -> u.setControlRequest(ControlRequest.PAUSE)));
            return active.size();
        });
        log.info("Upload processing stopped ({} active jobs signalled)", signalled);
        return signalled;
    }

    /**
     * Removes every job that is not in progress.
     *
     * @return the number of jobs removed
     */
    public int clearQueue() {
        int removed = store.removeUploads(j -> j.getStatus() != UploadStatus.IN_PROGRESS);
        log.info("Upload queue cleared: {} jobs removed", removed);
        return removed;
    }

    public UploadStatistics getStatistics() {
        List<UploadJob> jobs = store.listUploads();
        long totalBytes = 0;
        long uploadedBytes = 0;
        long remainingBytes = 0;
        long[] counts = new long[UploadStatus.values().length];
        double speedSum = 0;
        int activeCount = 0;

        for (UploadJob job : jobs) {
            counts[job.getStatus().ordinal()]++;
            totalBytes += job.getFileSize();
            uploadedBytes += job.getUploadedBytes();
            if (!job.getStatus().isTerminal()) {
                remainingBytes += job.getFileSize() - job.getUploadedBytes();
            }
            if (job.getStatus() == UploadStatus.IN_PROGRESS) {
                speedSum += job.getSpeedMbps();
                activeCount++;
            }
        }

        double averageSpeed = activeCount == 0 ? 0 : speedSum / activeCount;
        Long eta = averageSpeed > 0 ? (long) (remainingBytes / (double) UploadConfig.MIB / averageSpeed) : null;

        return new UploadStatistics(
                jobs.size(),
                counts[UploadStatus.PENDING.ordinal()],
                counts[UploadStatus.IN_PROGRESS.ordinal()],
                counts[UploadStatus.COMPLETED.ordinal()],
                counts[UploadStatus.FAILED.ordinal()],
                counts[UploadStatus.PAUSED.ordinal()],
                counts[UploadStatus.CANCELLED.ordinal()],
                totalBytes,
                uploadedBytes,
                averageSpeed,
                eta);
    }

    /**
     * Starts pending jobs, oldest queue position first, until the concurrency ceiling is reached.
     */
    private void dispatch() {
        synchronized (dispatchLock) {
            if (!processing) {
                return;
            }
            UploadConfig current = config;
            ThreadPoolTaskExecutor parts = partExecutor;
            while (true) {
                Optional<UploadJob> next = store.atomically(() -> {
                    int active = store.findUploads(j -> j.getStatus() == UploadStatus.IN_PROGRESS).size();
                    if (active >= current.getMaxConcurrentUploads()) {
                        return Optional.<UploadJob>empty();
                    }
                    return store.nextPendingUpload().flatMap(pending -> store.updateUpload(pending.getId(), j -> {
                        j.transitionTo(UploadStatus.IN_PROGRESS);
                        j.setStartedAt(Instant.now());
                        j.setErrorMessage(null);
                        j.setControlRequest(ControlRequest.NONE);
                    }));
                });
                if (next.isEmpty()) {
                    return;
                }

                String jobId = next.get().getId();
                try {
                    uploadExecutor.execute(() -> runJob(jobId, current, parts));
                } catch (RejectedExecutionException e) {
                    log.error("Upload pool rejected job {}, returning it to the queue", jobId, e);
                    store.updateUpload(jobId, j -> j.transitionTo(UploadStatus.PENDING));
                    return;
                }
            }
        }
    }

    private void runJob(String jobId, UploadConfig jobConfig, ThreadPoolTaskExecutor parts) {
        try {
            UploadWorker.Outcome outcome = uploadWorker.execute(jobId, jobConfig, parts);
            log.debug("Upload {} finished with {}", jobId, outcome);
        } finally {
            dispatch();
        }
    }

    private UploadJob requeue(String jobId) {
        long sequence = store.nextQueueSequence();
        boolean resumable = config.isEnableResume();
        return update(jobId, j -> {
            j.transitionTo(UploadStatus.PENDING);
            j.setQueueSequence(sequence);
            j.setControlRequest(ControlRequest.NONE);
            if (!resumable) {
                j.setUploadedBytes(0);
            }
        });
    }

    private UploadJob update(String jobId, Consumer<UploadJob> mutation) {
        return store.updateUpload(jobId, mutation)
                .orElseThrow(() -> new JobOperationException(JOB_NOT_FOUND, "Upload not found: " + jobId));
    }

    private void createExecutors(UploadConfig cfg) {
        int uploads = cfg.getMaxConcurrentUploads();
        int parts = uploads * cfg.getMaxConcurrentParts();
        uploadExecutor = AsyncConfig.boundedExecutor("upload-", uploads, uploads * 2);
        partExecutor = AsyncConfig.boundedExecutor("upload-part-", parts, parts * 2);
    }

    private void shutdownExecutors() {
        if (uploadExecutor != null) {
            uploadExecutor.shutdown();
        }
        if (partExecutor != null) {
            partExecutor.shutdown();
        }
    }

    @PreDestroy
    public void shutdown() {
        synchronized (dispatchLock) {
            processing = false;
        }
        log.info("Shutting down upload executors");
        shutdownExecutors();
    }
}
