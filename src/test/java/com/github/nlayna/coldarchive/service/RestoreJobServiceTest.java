package com.github.nlayna.coldarchive.service;

import com.github.nlayna.coldarchive.client.ArchiveRestoreState;
import com.github.nlayna.coldarchive.client.ObjectStoreClient;
import com.github.nlayna.coldarchive.config.ArchiveProperties;
import com.github.nlayna.coldarchive.exception.JobOperationException;
import com.github.nlayna.coldarchive.exception.PermanentTransferException;
import com.github.nlayna.coldarchive.exception.TransientTransferException;
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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RestoreJobServiceTest {

    private static final String KEY = "uploads/2024/clip.mov";

    @Mock
    private ObjectStoreClient objectStore;

    @Mock
    private CredentialVerifier credentialVerifier;

    @Mock
    private RestoredObjectDownloader downloader;

    private JobRecordStore store;
    private RestoreJobService restoreJobService;
    private final List<Notification> notifications = Collections.synchronizedList(new ArrayList<>());

    @BeforeEach
    void setUp() {
        store = new JobRecordStore();
        ArchiveProperties properties = new ArchiveProperties();
        properties.getRestore().setRequestAttempts(1);
        NotificationHub hub = new NotificationHub(Runnable::run, properties);
        hub.subscribeStatus(notifications::add);
        restoreJobService = new RestoreJobService(store, objectStore, credentialVerifier, downloader, hub,
                properties, Runnable::run, Runnable::run);
    }

    private List<NotificationStatus> statuses() {
        synchronized (notifications) {
            return notifications.stream().map(Notification::status).toList();
        }
    }

    private void completeRestore(String key) throws Exception {
        restoreJobService.requestRestore(key, RestoreTier.BULK);
        RestoreJob job = store.getRestore(key).orElseThrow();
        restoreJobService.applyExternalState(job,
                new ArchiveRestoreState(ArchiveRestoreState.Phase.RESTORED, Instant.now().plus(7, ChronoUnit.DAYS)));
    }

    @Test
    void requestRestore_newKey_sendsRequestAndNotifies() throws Exception {
        RestoreJob job = restoreJobService.requestRestore(KEY, null);

        assertThat(job.getTier()).isEqualTo(RestoreTier.STANDARD);
        assertThat(job.getStatus()).isEqualTo(RestoreStatus.IN_PROGRESS);
        verify(objectStore).requestRestore(KEY, RestoreTier.STANDARD, 7);
        assertThat(store.getRestore(KEY).orElseThrow().isSubmitted()).isTrue();
        assertThat(notifications).singleElement().satisfies(n -> {
            assertThat(n.status()).isEqualTo(NotificationStatus.REQUESTED);
            assertThat(n.source()).isEqualTo(NotificationSource.RESTORE);
            assertThat(n.subject()).isEqualTo(KEY);
        });
    }

    @Test
    void requestRestore_alreadyInProgress_returnsExistingJobUnchanged() throws Exception {
        RestoreJob first = restoreJobService.requestRestore(KEY, RestoreTier.BULK);

        RestoreJob second = restoreJobService.requestRestore(KEY, RestoreTier.EXPEDITED);

        assertThat(second.getJobId()).isEqualTo(first.getJobId());
        assertThat(second.getRequestedAt()).isEqualTo(first.getRequestedAt());
        assertThat(second.getTier()).isEqualTo(RestoreTier.BULK);
        verify(objectStore, times(1)).requestRestore(anyString(), any(), anyInt());
    }

    @Test
    void requestRestore_blankKey_throwsIllegalArgument() {
        assertThatThrownBy(() -> restoreJobService.requestRestore(" ", RestoreTier.STANDARD))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(objectStore);
    }

    @Test
    void requestRestore_permanentError_failsJobWithStoreMessage() throws Exception {
        doThrow(new PermanentTransferException("Access Denied"))
                .when(objectStore).requestRestore(eq(KEY), any(), anyInt());

        restoreJobService.requestRestore(KEY, RestoreTier.STANDARD);

        RestoreJob job = store.getRestore(KEY).orElseThrow();
        assertThat(job.getStatus()).isEqualTo(RestoreStatus.FAILED);
        assertThat(job.getErrorMessage()).isEqualTo("Access Denied");
        assertThat(statuses()).containsExactly(NotificationStatus.FAILED);
    }

    @Test
    void requestRestore_transientError_leavesJobUnsubmittedForNextTick() throws Exception {
        doThrow(new TransientTransferException("Service Unavailable"))
                .when(objectStore).requestRestore(eq(KEY), any(), anyInt());

        restoreJobService.requestRestore(KEY, RestoreTier.STANDARD);

        RestoreJob job = store.getRestore(KEY).orElseThrow();
        assertThat(job.getStatus()).isEqualTo(RestoreStatus.IN_PROGRESS);
        assertThat(job.isSubmitted()).isFalse();
        assertThat(notifications).isEmpty();
    }

    @Test
    void requestRestore_afterFailedJob_startsNewJob() throws Exception {
        doThrow(new PermanentTransferException("Access Denied"))
                .doNothing()
                .when(objectStore).requestRestore(eq(KEY), any(), anyInt());
        RestoreJob failed = restoreJobService.requestRestore(KEY, RestoreTier.STANDARD);

        RestoreJob retried = restoreJobService.requestRestore(KEY, RestoreTier.STANDARD);

        assertThat(retried.getJobId()).isNotEqualTo(failed.getJobId());
        assertThat(store.getRestore(KEY).orElseThrow().isSubmitted()).isTrue();
    }

    @Test
    void checkStatus_unknownKey_returnsNotFound() throws Exception {
        RestoreStatusResult result = restoreJobService.checkStatus("never/requested");

        assertThat(result.status()).isEqualTo(RestoreStatus.NOT_FOUND);
        assertThat(result.restored()).isFalse();
        verifyNoInteractions(objectStore);
    }

    @Test
    void checkStatus_restoredCopyAvailable_completesJobOnce() throws Exception {
        Instant expiry = Instant.now().plus(7, ChronoUnit.DAYS);
        when(objectStore.getRestoreState(KEY))
                .thenReturn(new ArchiveRestoreState(ArchiveRestoreState.Phase.RESTORED, expiry));
        restoreJobService.requestRestore(KEY, RestoreTier.STANDARD);

        RestoreStatusResult first = restoreJobService.checkStatus(KEY);
        RestoreStatusResult second = restoreJobService.checkStatus(KEY);

        assertThat(first.restored()).isTrue();
        assertThat(first.status()).isEqualTo(RestoreStatus.COMPLETED);
        assertThat(first.expiresAt()).isEqualTo(expiry);
        assertThat(second).isEqualTo(first);
        verify(objectStore, times(1)).getRestoreState(KEY);
        assertThat(statuses()).containsExactly(NotificationStatus.REQUESTED, NotificationStatus.COMPLETED);
    }

    @Test
    void checkStatus_stillRestoring_keepsJobInProgress() throws Exception {
        when(objectStore.getRestoreState(KEY)).thenReturn(ArchiveRestoreState.of(ArchiveRestoreState.Phase.IN_PROGRESS));
        restoreJobService.requestRestore(KEY, RestoreTier.STANDARD);

        RestoreStatusResult result = restoreJobService.checkStatus(KEY);

        assertThat(result.status()).isEqualTo(RestoreStatus.IN_PROGRESS);
        assertThat(result.restored()).isFalse();
    }

    @Test
    void applyExternalState_requestNoLongerActive_failsJob() throws Exception {
        restoreJobService.requestRestore(KEY, RestoreTier.STANDARD);
        RestoreJob job = store.getRestore(KEY).orElseThrow();

        RestoreJob failed = restoreJobService.applyExternalState(job,
                ArchiveRestoreState.of(ArchiveRestoreState.Phase.NOT_RESTORED));

        assertThat(failed.getStatus()).isEqualTo(RestoreStatus.FAILED);
        assertThat(failed.getErrorMessage()).isEqualTo("Restore request is no longer active");
    }

    @Test
    void applyExternalState_objectMissing_failsJob() throws Exception {
        restoreJobService.requestRestore(KEY, RestoreTier.STANDARD);
        RestoreJob job = store.getRestore(KEY).orElseThrow();

        RestoreJob failed = restoreJobService.applyExternalState(job,
                ArchiveRestoreState.of(ArchiveRestoreState.Phase.NOT_FOUND));

        assertThat(failed.getStatus()).isEqualTo(RestoreStatus.FAILED);
        assertThat(failed.getErrorMessage()).isEqualTo("Object not found: " + KEY);
    }

    @Test
    void cancel_inProgress_cancelsAndNotifies() throws Exception {
        restoreJobService.requestRestore(KEY, RestoreTier.STANDARD);

        boolean cancelled = restoreJobService.cancel(KEY);

        assertThat(cancelled).isTrue();
        assertThat(store.getRestore(KEY).orElseThrow().getStatus()).isEqualTo(RestoreStatus.CANCELLED);
        assertThat(statuses()).containsExactly(NotificationStatus.REQUESTED, NotificationStatus.CANCELLED);
    }

    @Test
    void cancel_terminalJob_returnsFalseAndLeavesStatus() throws Exception {
        completeRestore(KEY);

        boolean cancelled = restoreJobService.cancel(KEY);

        assertThat(cancelled).isFalse();
        assertThat(store.getRestore(KEY).orElseThrow().getStatus()).isEqualTo(RestoreStatus.COMPLETED);
    }

    @Test
    void cancel_unknownKey_throwsJobNotFound() {
        assertThatThrownBy(() -> restoreJobService.cancel("never/requested"))
                .isInstanceOf(JobOperationException.class)
                .extracting(e -> ((JobOperationException) e).getReason())
                .isEqualTo(JobOperationException.Reason.JOB_NOT_FOUND);
    }

    @Test
    void clearHistory_removesOnlyFinishedJobs() throws Exception {
        completeRestore("a.mov");
        completeRestore("b.mov");
        restoreJobService.requestRestore("c.mov", RestoreTier.STANDARD);

        int removed = restoreJobService.clearHistory();

        assertThat(removed).isEqualTo(2);
        assertThat(restoreJobService.listJobs()).extracting(RestoreJob::getKey).containsExactly("c.mov");
    }

    @Test
    void download_blankPath_throwsIllegalArgument() {
        assertThatThrownBy(() -> restoreJobService.download(KEY, ""))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void download_unknownKey_throwsJobNotFound() {
        assertThatThrownBy(() -> restoreJobService.download(KEY, "/tmp/clip.mov"))
                .isInstanceOf(JobOperationException.class)
                .extracting(e -> ((JobOperationException) e).getReason())
                .isEqualTo(JobOperationException.Reason.JOB_NOT_FOUND);
    }

    @Test
    void download_restoreNotCompleted_rejectedAsNotAvailable() throws Exception {
        restoreJobService.requestRestore(KEY, RestoreTier.STANDARD);

        assertThatThrownBy(() -> restoreJobService.download(KEY, "/tmp/clip.mov"))
                .isInstanceOf(JobOperationException.class)
                .extracting(e -> ((JobOperationException) e).getReason())
                .isEqualTo(JobOperationException.Reason.RESTORE_NOT_AVAILABLE);
    }

    @Test
    void download_restoredCopy_recordsCompletedDownload() throws Exception {
        completeRestore(KEY);
        when(objectStore.getRestoreState(KEY))
                .thenReturn(new ArchiveRestoreState(ArchiveRestoreState.Phase.RESTORED, null));
        when(downloader.download(eq(KEY), eq(Path.of("/tmp/clip.mov")), any()))
                .thenReturn(new DownloadResult(4096, true));

        DownloadProgress started = restoreJobService.download(KEY, "/tmp/clip.mov");

        assertThat(started.status()).isEqualTo(DownloadStatus.DOWNLOADING);
        assertThat(restoreJobService.getDownloads()).singleElement().satisfies(d -> {
            assertThat(d.status()).isEqualTo(DownloadStatus.COMPLETED);
            assertThat(d.downloadedBytes()).isEqualTo(4096);
        });
        assertThat(notifications).filteredOn(n -> n.source() == NotificationSource.DOWNLOAD)
                .extracting(Notification::status).containsExactly(NotificationStatus.COMPLETED);
    }

    @Test
    void download_restoredCopyExpired_failsWithExpiredNotification() throws Exception {
        completeRestore(KEY);
        when(objectStore.getRestoreState(KEY)).thenReturn(ArchiveRestoreState.of(ArchiveRestoreState.Phase.NOT_RESTORED));

        restoreJobService.download(KEY, "/tmp/clip.mov");

        assertThat(restoreJobService.getDownloads()).singleElement().satisfies(d -> {
            assertThat(d.status()).isEqualTo(DownloadStatus.FAILED);
            assertThat(d.errorMessage()).contains("no longer available");
        });
        assertThat(notifications).filteredOn(n -> n.source() == NotificationSource.DOWNLOAD)
                .extracting(Notification::status).containsExactly(NotificationStatus.EXPIRED);
        verifyNoInteractions(downloader);
    }

    @Test
    void download_transferFails_recordsFailure() throws Exception {
        completeRestore(KEY);
        when(objectStore.getRestoreState(KEY))
                .thenReturn(new ArchiveRestoreState(ArchiveRestoreState.Phase.RESTORED, null));
        when(downloader.download(eq(KEY), any(), any()))
                .thenThrow(new TransientTransferException("Connection reset"));

        restoreJobService.download(KEY, "/tmp/clip.mov");

        assertThat(restoreJobService.getDownloads()).singleElement().satisfies(d -> {
            assertThat(d.status()).isEqualTo(DownloadStatus.FAILED);
            assertThat(d.errorMessage()).isEqualTo("Connection reset");
        });
    }

    @Test
    void tierInfo_describesEveryTier() {
        assertThat(restoreJobService.tierInfo())
                .extracting(RestoreTier.RestoreTierInfo::tier)
                .containsExactly(RestoreTier.EXPEDITED, RestoreTier.STANDARD, RestoreTier.BULK);
    }
}
