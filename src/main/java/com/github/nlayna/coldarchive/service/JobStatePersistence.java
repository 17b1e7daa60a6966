package com.github.nlayna.coldarchive.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.nlayna.coldarchive.config.ArchiveProperties;
import com.github.nlayna.coldarchive.model.ControlRequest;
import com.github.nlayna.coldarchive.model.JobSnapshot;
import com.github.nlayna.coldarchive.model.UploadJob;
import com.github.nlayna.coldarchive.model.UploadStatus;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * Keeps a JSON snapshot of the job store on disk. The snapshot is loaded at startup and rewritten
 * whenever the store has changed, plus once more on shutdown.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "archive.persistence", name = "enabled", havingValue = "true")
public class JobStatePersistence {

    private final JobRecordStore store;
    private final ObjectMapper objectMapper;
    private final Path stateFile;

    public JobStatePersistence(JobRecordStore store, ObjectMapper objectMapper, ArchiveProperties archiveProperties) {
        this.store = store;
        this.objectMapper = objectMapper;
        this.stateFile = Paths.get(archiveProperties.getPersistence().getPath()).toAbsolutePath();
    }

    @PostConstruct
    public void load() {
        if (!Files.exists(stateFile)) {
            log.info("No job state at {}, starting empty", stateFile);
            return;
        }
        try {
            JobSnapshot snapshot = objectMapper.readValue(stateFile.toFile(), JobSnapshot.class);
            store.load(reconcile(snapshot));
            log.info("Loaded {} uploads and {} restores from {}",
                    snapshot.uploads().size(), snapshot.restores().size(), stateFile);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read job state from " + stateFile, e);
        }
    }

    /**
     * Uploads that were running when the process stopped go back to the queue, keeping their multipart
     * upload id so a resumable configuration can continue them. Pending control requests are dropped.
     * Restores stay in progress; the first poll tick finds out their real state.
     */
    static JobSnapshot reconcile(JobSnapshot snapshot) {
        List<UploadJob> uploads = snapshot.uploads().stream().map(job -> {
            UploadJob copy = job.copy();
            if (copy.getStatus() == UploadStatus.IN_PROGRESS) {
                copy.transitionTo(UploadStatus.PENDING);
                copy.setSpeedMbps(0);
                copy.setEtaSeconds(null);
            }
            copy.setControlRequest(ControlRequest.NONE);
            return copy;
        }).toList();
        return new JobSnapshot(uploads, snapshot.restores());
    }

    @Scheduled(fixedDelayString = "${archive.persistence.flush-interval-ms:5000}")
    public void flushIfDirty() {
        if (store.takeDirty()) {
            write();
        }
    }

    @PreDestroy
    public void flush() {
        store.takeDirty();
        write();
    }

    private synchronized void write() {
        JobSnapshot snapshot = store.snapshot();
        Path tempFile = stateFile.resolveSibling(stateFile.getFileName() + ".tmp");
        try {
            Path parentDir = stateFile.getParent();
            if (parentDir != null) {
                Files.createDirectories(parentDir);
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(tempFile.toFile(), snapshot);
            Files.move(tempFile, stateFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.debug("Saved {} uploads and {} restores to {}", snapshot.uploads().size(), snapshot.restores().size(), stateFile);
        } catch (IOException e) {
            store.markDirty();
            log.error("Failed to save job state to {}: {}", stateFile, e.getMessage(), e);
        }
    }
}
