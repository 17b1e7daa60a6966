package com.github.nlayna.coldarchive.service;

import com.github.nlayna.coldarchive.model.JobSnapshot;
import com.github.nlayna.coldarchive.model.RestoreJob;
import com.github.nlayna.coldarchive.model.UploadJob;
import com.github.nlayna.coldarchive.model.UploadStatus;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Every upload and restore record, behind one lock. Uploads are keyed by job id in submission
 * order, restores by object key. Callers only ever see copies; changes go through the
 * {@code update*} methods, which apply a mutation to a copy and store it only if the mutation
 * completes.
 */
@Component
public class JobRecordStore {

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, UploadJob> uploads = new LinkedHashMap<>();
    private final Map<String, RestoreJob> restores = new LinkedHashMap<>();
    private long queueSequence;
    private boolean dirty;

    /**
     * Runs {@code action} while holding the store lock, so several reads and writes appear as one step
     * to every other caller.
     */
    public <T> T atomically(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public long nextQueueSequence() {
        return atomically(() -> ++queueSequence);
    }

    public UploadJob insertUpload(UploadJob job) {
        return atomically(() -> {
            if (uploads.containsKey(job.getId())) {
                throw new IllegalStateException("Upload " + job.getId() + " already exists");
            }
            uploads.put(job.getId(), job.copy());
            dirty = true;
            return job.copy();
        });
    }

    public Optional<UploadJob> getUpload(String id) {
        return atomically(() -> Optional.ofNullable(uploads.get(id)).map(UploadJob::copy));
    }

    public List<UploadJob> listUploads() {
        return findUploads(job -> true);
    }

    public List<UploadJob> findUploads(Predicate<UploadJob> filter) {
        return atomically(() -> uploads.values().stream().filter(filter).map(UploadJob::copy).toList());
    }

    public Optional<UploadJob> updateUpload(String id, Consumer<UploadJob> mutation) {
        return atomically(() -> {
            UploadJob current = uploads.get(id);
            if (current == null) {
                return Optional.empty();
            }
            UploadJob updated = current.copy();
            mutation.accept(updated);
            uploads.put(id, updated);
            dirty = true;
            return Optional.of(updated.copy());
        });
    }

    public int removeUploads(Predicate<UploadJob> filter) {
        return atomically(() -> {
            int removed = 0;
            Iterator<UploadJob> it = uploads.values().iterator();
            while (it.hasNext()) {
                if (filter.test(it.next())) {
                    it.remove();
                    removed++;
                }
            }
            if (removed > 0) {
                dirty = true;
            }
            return removed;
        });
    }

    /**
     * The pending upload submitted or re-queued earliest.
     */
    public Optional<UploadJob> nextPendingUpload() {
        return atomically(() -> uploads.values().stream()
                .filter(job -> job.getStatus() == UploadStatus.PENDING)
                .min(Comparator.comparingLong(UploadJob::getQueueSequence))
                .map(UploadJob::copy));
    }

    /**
     * Spends one unit of the job's retry budget.
     *
     * @return false if the budget was already exhausted, in which case nothing changes
     */
    public boolean consumeUploadRetry(String id, int retryLimit, String error) {
        return atomically(() -> {
            UploadJob job = uploads.get(id);
            if (job == null || job.getRetryCount() >= retryLimit) {
                return false;
            }
            job.setRetryCount(job.getRetryCount() + 1);
            job.setErrorMessage(error);
            dirty = true;
            return true;
        });
    }

    public RestoreJob putRestore(RestoreJob job) {
        return atomically(() -> {
            restores.put(job.getKey(), job.copy());
            dirty = true;
            return job.copy();
        });
    }

    public Optional<RestoreJob> getRestore(String key) {
        return atomically(() -> Optional.ofNullable(restores.get(key)).map(RestoreJob::copy));
    }

    public List<RestoreJob> listRestores() {
        return findRestores(job -> true);
    }

    public List<RestoreJob> findRestores(Predicate<RestoreJob> filter) {
        return atomically(() -> restores.values().stream().filter(filter).map(RestoreJob::copy).toList());
    }

    public Optional<RestoreJob> updateRestore(String key, Consumer<RestoreJob> mutation) {
        return atomically(() -> {
            RestoreJob current = restores.get(key);
            if (current == null) {
                return Optional.empty();
            }
            RestoreJob updated = current.copy();
            mutation.accept(updated);
            restores.put(key, updated);
            dirty = true;
            return Optional.of(updated.copy());
        });
    }

    public int removeRestores(Predicate<RestoreJob> filter) {
        return atomically(() -> {
            int before = restores.size();
            restores.values().removeIf(filter);
            int removed = before - restores.size();
            if (removed > 0) {
                dirty = true;
            }
            return removed;
        });
    }

    public JobSnapshot snapshot() {
        return atomically(() -> new JobSnapshot(
                uploads.values().stream().map(UploadJob::copy).toList(),
                restores.values().stream().map(RestoreJob::copy).toList()));
    }

    /**
     * Replaces the content of the store. The queue sequence continues after the highest loaded one.
     */
    public void load(JobSnapshot snapshot) {
        atomically(() -> {
            uploads.clear();
            restores.clear();
            long maxSequence = 0;
            for (UploadJob job : snapshot.uploads()) {
                uploads.put(job.getId(), job.copy());
                maxSequence = Math.max(maxSequence, job.getQueueSequence());
            }
            for (RestoreJob job : snapshot.restores()) {
                restores.put(job.getKey(), job.copy());
            }
            queueSequence = Math.max(queueSequence, maxSequence);
            dirty = false;
            return null;
        });
    }

    public void markDirty() {
        atomically(() -> dirty = true);
    }

    /**
     * @return whether anything changed since the previous call
     */
    public boolean takeDirty() {
        return atomically(() -> {
            boolean wasDirty = dirty;
            dirty = false;
            return wasDirty;
        });
    }
}
