package com.github.nlayna.coldarchive.controller;

import com.github.nlayna.coldarchive.exception.JobOperationException;
import com.github.nlayna.coldarchive.model.ControlRequest;
import com.github.nlayna.coldarchive.model.SubmissionResult;
import com.github.nlayna.coldarchive.model.UploadConfig;
import com.github.nlayna.coldarchive.model.UploadJob;
import com.github.nlayna.coldarchive.model.UploadStatistics;
import com.github.nlayna.coldarchive.model.UploadStatus;
import com.github.nlayna.coldarchive.model.UploadTier;
import com.github.nlayna.coldarchive.service.UploadQueueService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(UploadController.class)
class UploadControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private UploadQueueService uploadQueueService;

    private static UploadJob job(String id, UploadStatus status) {
        return UploadJob.builder()
                .id(id)
                .filePath("/media/clip.mov")
                .fileName("clip.mov")
                .fileSize(2048)
                .uploadedBytes(1024)
                .objectKey("uploads/clip.mov")
                .createdAt(Instant.parse("2024-03-07T10:15:30Z"))
                .status(status)
                .controlRequest(ControlRequest.NONE)
                .build();
    }

    @Test
    void submitFiles_validRequest_returns202WithAcceptedJobs() throws Exception {
        when(uploadQueueService.submitFiles(any())).thenReturn(new SubmissionResult(
                List.of(job("job-1", UploadStatus.PENDING)),
                List.of(new SubmissionResult.Rejection("/media/missing.mov",
                        JobOperationException.Reason.FILE_NOT_FOUND, "File not found: /media/missing.mov"))));

        mockMvc.perform(post("/api/v1/uploads")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                    "filePaths": ["/media/clip.mov", "/media/missing.mov"],
                                    "keyOptions": {"prefix": "archive", "useDateFolder": true}
                                }
                                """))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.accepted[0].id").value("job-1"))
                .andExpect(jsonPath("$.accepted[0].status").value("PENDING"))
                .andExpect(jsonPath("$.accepted[0].progress").value(50.0))
                .andExpect(jsonPath("$.rejected[0].reason").value("FILE_NOT_FOUND"));
    }

    @Test
    void submitFiles_emptyPaths_returns400() throws Exception {
        mockMvc.perform(post("/api/v1/uploads")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"filePaths": []}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("filePaths must not be empty"));

        verify(uploadQueueService, never()).submitFiles(any());
    }

    @Test
    void submitFiles_malformedBody_returns400() throws Exception {
        mockMvc.perform(post("/api/v1/uploads")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid request body"));
    }

    @Test
    void getJob_unknownId_returns404() throws Exception {
        when(uploadQueueService.getJob("missing"))
                .thenThrow(new JobOperationException(JobOperationException.Reason.JOB_NOT_FOUND, "Upload not found: missing"));

        mockMvc.perform(get("/api/v1/uploads/missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.reason").value("JOB_NOT_FOUND"))
                .andExpect(jsonPath("$.error").value("Upload not found: missing"));
    }

    @Test
    void removeJob_inProgress_returns409() throws Exception {
        doThrow(new JobOperationException(JobOperationException.Reason.JOB_ACTIVE, "Upload job-1 is in progress; cancel it first"))
                .when(uploadQueueService).removeJob("job-1");

        mockMvc.perform(delete("/api/v1/uploads/job-1"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.reason").value("JOB_ACTIVE"));
    }

    @Test
    void removeJob_pending_returns204() throws Exception {
        mockMvc.perform(delete("/api/v1/uploads/job-1"))
                .andExpect(status().isNoContent());

        verify(uploadQueueService).removeJob("job-1");
    }

    @Test
    void cancel_activeJob_returnsJobWithCancelRequest() throws Exception {
        UploadJob signalled = job("job-1", UploadStatus.IN_PROGRESS);
        signalled.setControlRequest(ControlRequest.CANCEL);
        when(uploadQueueService.cancel("job-1")).thenReturn(signalled);

        mockMvc.perform(post("/api/v1/uploads/job-1/cancel"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("IN_PROGRESS"))
                .andExpect(jsonPath("$.controlRequest").value("CANCEL"));
    }

    @Test
    void stop_returnsSignalledCount() throws Exception {
        when(uploadQueueService.stop()).thenReturn(2);

        mockMvc.perform(post("/api/v1/uploads/stop"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.processing").value(false))
                .andExpect(jsonPath("$.signalled").value(2));
    }

    @Test
    void clearQueue_returnsRemovedCount() throws Exception {
        when(uploadQueueService.clearQueue()).thenReturn(3);

        mockMvc.perform(delete("/api/v1/uploads"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.removed").value(3));
    }

    @Test
    void initialize_tierOnly_installsThatTiersDefaults() throws Exception {
        when(uploadQueueService.initialize(any())).thenAnswer(invocation -> invocation.getArgument(0));

        mockMvc.perform(post("/api/v1/uploads/initialize")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"tier": "PREMIUM"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tier").value("PREMIUM"))
                .andExpect(jsonPath("$.maxConcurrentUploads").value(8));

        ArgumentCaptor<UploadConfig> installed = ArgumentCaptor.forClass(UploadConfig.class);
        verify(uploadQueueService).initialize(installed.capture());
        UploadConfig config = installed.getValue();
        assertThat(config.getTier()).isEqualTo(UploadTier.PREMIUM);
        assertThat(config.getMaxConcurrentUploads()).isEqualTo(8);
        assertThat(config.getMaxConcurrentParts()).isEqualTo(8);
        assertThat(config.isAdaptiveChunkSize()).isTrue();
        assertThat(config.isEnableResume()).isTrue();
        assertThat(config.getRetryAttempts()).isEqualTo(10);
    }

    @Test
    void initialize_overrides_replaceOnlyTheGivenFields() throws Exception {
        when(uploadQueueService.initialize(any())).thenAnswer(invocation -> invocation.getArgument(0));

        mockMvc.perform(post("/api/v1/uploads/initialize")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"tier": "PREMIUM", "maxConcurrentParts": 4, "bandwidthLimitMbps": 20.0}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.maxConcurrentParts").value(4))
                .andExpect(jsonPath("$.maxConcurrentUploads").value(8))
                .andExpect(jsonPath("$.maxChunkSizeMb").value(100))
                .andExpect(jsonPath("$.bandwidthLimitMbps").value(20.0));
    }

    @Test
    void initialize_invalidConfig_returns409() throws Exception {
        when(uploadQueueService.initialize(any()))
                .thenThrow(new JobOperationException(JobOperationException.Reason.INVALID_CONFIG,
                        "Free tier uploads one file at a time"));

        mockMvc.perform(post("/api/v1/uploads/initialize")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"tier": "FREE", "maxConcurrentUploads": 4}
                                """))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.reason").value("INVALID_CONFIG"));
    }

    @Test
    void getStatistics_returnsAggregates() throws Exception {
        when(uploadQueueService.getStatistics())
                .thenReturn(new UploadStatistics(3, 1, 1, 1, 0, 0, 0, 3000, 1500, 2.5, 12L));

        mockMvc.perform(get("/api/v1/uploads/statistics"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalFiles").value(3))
                .andExpect(jsonPath("$.averageSpeedMbps").value(2.5))
                .andExpect(jsonPath("$.estimatedTimeRemaining").value(12));
    }
}
