package com.github.nlayna.coldarchive.controller;

import com.github.nlayna.coldarchive.model.SubmissionResult;
import com.github.nlayna.coldarchive.model.UploadConfig;
import com.github.nlayna.coldarchive.model.UploadConfigRequest;
import com.github.nlayna.coldarchive.model.UploadJob;
import com.github.nlayna.coldarchive.model.UploadStatistics;
import com.github.nlayna.coldarchive.model.UploadSubmission;
import com.github.nlayna.coldarchive.service.UploadQueueService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/uploads")
@RequiredArgsConstructor
public class UploadController {

    private final UploadQueueService uploadQueueService;

    @PostMapping("/initialize")
    public UploadConfig initialize(@RequestBody UploadConfigRequest request) {
        return uploadQueueService.initialize(request.toUploadConfig());
    }

    @PostMapping
    public ResponseEntity<?> submitFiles(@RequestBody UploadSubmission submission) {
        if (submission.getFilePaths() == null || submission.getFilePaths().isEmpty()) {
            return ResponseEntity.badRequest()
                    .body(Map.of("error", "filePaths must not be empty"));
        }
        SubmissionResult result = uploadQueueService.submitFiles(submission);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(result);
    }

    @GetMapping
    public List<UploadJob> getJobs() {
        return uploadQueueService.getJobs();
    }

    @GetMapping("/statistics")
    public UploadStatistics getStatistics() {
        return uploadQueueService.getStatistics();
    }

    @GetMapping("/{jobId}")
    public UploadJob getJob(@PathVariable String jobId) {
        return uploadQueueService.getJob(jobId);
    }

    @DeleteMapping("/{jobId}")
    public ResponseEntity<Void> removeJob(@PathVariable String jobId) {
        uploadQueueService.removeJob(jobId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{jobId}/cancel")
    public UploadJob cancel(@PathVariable String jobId) {
        return uploadQueueService.cancel(jobId);
    }

    @PostMapping("/{jobId}/pause")
    public UploadJob pause(@PathVariable String jobId) {
        return uploadQueueService.pause(jobId);
    }

    @PostMapping("/{jobId}/resume")
    public UploadJob resume(@PathVariable String jobId) {
        return uploadQueueService.resume(jobId);
    }

    @PostMapping("/{jobId}/retry")
    public UploadJob retry(@PathVariable String jobId) {
        return uploadQueueService.retry(jobId);
    }

    @PostMapping("/start")
    public Map<String, Object> start() {
        uploadQueueService.start();
        return Map.of("processing", true);
    }

    @PostMapping("/stop")
    public Map<String, Object> stop() {
        int signalled = uploadQueueService.stop();
        return Map.of("processing", false, "signalled", signalled);
    }

    @DeleteMapping
    public Map<String, Integer> clearQueue() {
        return Map.of("removed", uploadQueueService.clearQueue());
    }
}
