package com.github.nlayna.coldarchive.service;

import com.github.nlayna.coldarchive.model.JobSnapshot;
import com.github.nlayna.coldarchive.model.RestoreJob;
import com.github.nlayna.coldarchive.model.RestoreStatus;
import com.github.nlayna.coldarchive.model.RestoreTier;
import com.github.nlayna.coldarchive.model.UploadJob;
import com.github.nlayna.coldarchive.model.UploadStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobRecordStoreTest {

    private JobRecordStore store;

    @BeforeEach
    void setUp() {
        store = new JobRecordStore();
    }

    private UploadJob upload(String id, UploadStatus status) {
        return UploadJob.builder()
                .id(id)
                .filePath("/media/" + id)
                .fileName(id)
                .fileSize(100)
                .status(status)
                .queueSequence(store.nextQueueSequence())
                .build();
    }

    @Test
    void getUpload_returnsCopy() {
        store.insertUpload(upload("a", UploadStatus.PENDING));

        UploadJob copy = store.getUpload("a").orElseThrow();
        copy.setUploadedBytes(99);

        assertThat(store.getUpload("a").orElseThrow().getUploadedBytes()).isZero();
    }

    @Test
    void insertUpload_duplicateId_throws() {
        store.insertUpload(upload("a", UploadStatus.PENDING));

        assertThatThrownBy(() -> store.insertUpload(upload("a", UploadStatus.PENDING)))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void updateUpload_failingMutation_leavesRecordUnchanged() {
        store.insertUpload(upload("a", UploadStatus.PENDING));

        assertThatThrownBy(() -> store.updateUpload("a", j -> {
            j.setUploadedBytes(50);
            j.transitionTo(UploadStatus.COMPLETED);
        })).isInstanceOf(IllegalStateException.class);

        UploadJob job = store.getUpload("a").orElseThrow();
        assertThat(job.getUploadedBytes()).isZero();
        assertThat(job.getStatus()).isEqualTo(UploadStatus.PENDING);
    }

    @Test
    void updateUpload_unknownId_returnsEmpty() {
        assertThat(store.updateUpload("missing", j -> j.setUploadedBytes(1))).isEmpty();
    }

    @Test
    void nextPendingUpload_picksLowestQueueSequence() {
        store.insertUpload(upload("first", UploadStatus.PENDING));
        store.insertUpload(upload("second", UploadStatus.PENDING));
        store.insertUpload(upload("third", UploadStatus.PENDING));
        long requeued = store.nextQueueSequence();
        store.updateUpload("first", j -> j.setQueueSequence(requeued));

        assertThat(store.nextPendingUpload()).map(UploadJob::getId).contains("second");
    }

    @Test
    void consumeUploadRetry_stopsAtLimit() {
        store.insertUpload(upload("a", UploadStatus.IN_PROGRESS));

        assertThat(store.consumeUploadRetry("a", 2, "timeout 1")).isTrue();
        assertThat(store.consumeUploadRetry("a", 2, "timeout 2")).isTrue();
        assertThat(store.consumeUploadRetry("a", 2, "timeout 3")).isFalse();

        UploadJob job = store.getUpload("a").orElseThrow();
        assertThat(job.getRetryCount()).isEqualTo(2);
        assertThat(job.getErrorMessage()).isEqualTo("timeout 2");
    }

    @Test
    void removeUploads_returnsRemovedCount() {
        store.insertUpload(upload("a", UploadStatus.PENDING));
        store.insertUpload(upload("b", UploadStatus.IN_PROGRESS));
        store.insertUpload(upload("c", UploadStatus.FAILED));

        int removed = store.removeUploads(j -> j.getStatus() != UploadStatus.IN_PROGRESS);

        assertThat(removed).isEqualTo(2);
        assertThat(store.listUploads()).extracting(UploadJob::getId).containsExactly("b");
    }

    @Test
    void listUploads_keepsSubmissionOrder() {
        store.insertUpload(upload("c", UploadStatus.PENDING));
        store.insertUpload(upload("a", UploadStatus.PENDING));
        store.insertUpload(upload("b", UploadStatus.PENDING));

        assertThat(store.listUploads()).extracting(UploadJob::getId).containsExactly("c", "a", "b");
    }

    @Test
    void takeDirty_reportsChangesOnce() {
        assertThat(store.takeDirty()).isFalse();

        store.insertUpload(upload("a", UploadStatus.PENDING));

        assertThat(store.takeDirty()).isTrue();
        assertThat(store.takeDirty()).isFalse();
    }

    @Test
    void load_replacesContentAndContinuesSequence() {
        UploadJob loaded = UploadJob.builder().id("old").filePath("/old").status(UploadStatus.PENDING)
                .queueSequence(40).build();
        RestoreJob restore = RestoreJob.builder().jobId("r").key("videos/a.mov").tier(RestoreTier.BULK)
                .status(RestoreStatus.IN_PROGRESS).build();
        store.insertUpload(upload("gone", UploadStatus.PENDING));

        store.load(new JobSnapshot(List.of(loaded), List.of(restore)));

        assertThat(store.listUploads()).extracting(UploadJob::getId).containsExactly("old");
        assertThat(store.getRestore("videos/a.mov")).isPresent();
        assertThat(store.nextQueueSequence()).isEqualTo(41);
    }

    @Test
    void removeRestores_onlyMatching() {
        store.putRestore(RestoreJob.builder().jobId("1").key("a").status(RestoreStatus.COMPLETED).build());
        store.putRestore(RestoreJob.builder().jobId("2").key("b").status(RestoreStatus.IN_PROGRESS).build());

        assertThat(store.removeRestores(j -> j.getStatus().isTerminal())).isEqualTo(1);
        assertThat(store.listRestores()).extracting(RestoreJob::getKey).containsExactly("b");
    }
}
