package com.github.nlayna.coldarchive.controller;

import com.github.nlayna.coldarchive.exception.TransferException;
import com.github.nlayna.coldarchive.model.ArchivedObject;
import com.github.nlayna.coldarchive.model.DownloadProgress;
import com.github.nlayna.coldarchive.model.DownloadRequest;
import com.github.nlayna.coldarchive.model.RestoreJob;
import com.github.nlayna.coldarchive.model.RestoreStatusResult;
import com.github.nlayna.coldarchive.model.RestoreSubmission;
import com.github.nlayna.coldarchive.model.RestoreTier;
import com.github.nlayna.coldarchive.service.RestoreJobService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/restores")
@RequiredArgsConstructor
public class RestoreController {

    private final RestoreJobService restoreJobService;

    @PostMapping
    public ResponseEntity<RestoreJob> requestRestore(@RequestBody RestoreSubmission submission) {
        RestoreJob job = restoreJobService.requestRestore(submission.getKey(), submission.getTier());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(job);
    }

    @GetMapping("/status")
    public RestoreStatusResult checkStatus(@RequestParam String key) throws TransferException {
        return restoreJobService.checkStatus(key);
    }

    @GetMapping
    public List<RestoreJob> listJobs() {
        return restoreJobService.listJobs();
    }

    @PostMapping("/cancel")
    public ResponseEntity<Map<String, Object>> cancel(@RequestParam String key) {
        if (restoreJobService.cancel(key)) {
            return ResponseEntity.ok(Map.of("key", key, "cancelled", true));
        }
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(Map.of("key", key, "cancelled", false, "error", "Restore is not in progress"));
    }

    @DeleteMapping("/history")
    public Map<String, Integer> clearHistory() {
        return Map.of("removed", restoreJobService.clearHistory());
    }

    @PostMapping("/download")
    public ResponseEntity<DownloadProgress> download(@RequestBody DownloadRequest request) {
        DownloadProgress progress = restoreJobService.download(request.getKey(), request.getLocalPath());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(progress);
    }

    @GetMapping("/downloads")
    public List<DownloadProgress> getDownloads() {
        return restoreJobService.getDownloads();
    }

    @GetMapping("/objects")
    public List<ArchivedObject> listObjects(@RequestParam(required = false) String prefix) throws TransferException {
        return restoreJobService.listArchivedObjects(prefix);
    }

    @GetMapping("/tiers")
    public List<RestoreTier.RestoreTierInfo> tiers() {
        return restoreJobService.tierInfo();
    }
}
