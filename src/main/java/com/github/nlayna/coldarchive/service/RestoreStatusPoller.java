package com.github.nlayna.coldarchive.service;

import com.github.nlayna.coldarchive.config.ArchiveProperties;
import com.github.nlayna.coldarchive.exception.TransferException;
import com.github.nlayna.coldarchive.model.RestoreJob;
import com.github.nlayna.coldarchive.model.RestoreStatus;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.ScheduledFuture;

/**
 * Periodically drives in-progress restore jobs: sends requests that have not reached the object
 * store yet and asks the store about the others. Terminal jobs drop out of the next tick.
 */
@Slf4j
@Component
public class RestoreStatusPoller {

    private final JobRecordStore store;
    private final RestoreJobService restoreJobService;
    private final TaskScheduler restoreScheduler;
    private final ArchiveProperties archiveProperties;
    private ScheduledFuture<?> pollTask;

    public RestoreStatusPoller(JobRecordStore store,
                               RestoreJobService restoreJobService,
                               @Qualifier("restoreScheduler") TaskScheduler restoreScheduler,
                               ArchiveProperties archiveProperties) {
        this.store = store;
        this.restoreJobService = restoreJobService;
        this.restoreScheduler = restoreScheduler;
        this.archiveProperties = archiveProperties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public synchronized void start() {
        if (pollTask != null) {
            return;
        }
        pollTask = restoreScheduler.scheduleWithFixedDelay(this::pollOnce, archiveProperties.getRestore().getPollInterval());
        log.info("Restore polling started every {}", archiveProperties.getRestore().getPollInterval());
    }

    @PreDestroy
    public synchronized void stop() {
        if (pollTask != null) {
            pollTask.cancel(false);
            pollTask = null;
            log.info("Restore polling stopped");
        }
    }

    /**
     * One tick. A failure for one key is logged and left for the next tick.
     */
    public void pollOnce() {
        List<RestoreJob> active = store.findRestores(j -> j.getStatus() == RestoreStatus.IN_PROGRESS);
        if (active.isEmpty()) {
            return;
        }
        log.debug("Polling {} active restore jobs", active.size());

        for (RestoreJob job : active) {
            try {
                if (job.isSubmitted()) {
                    RestoreJob updated = restoreJobService.refreshStatus(job);
                    log.debug("Restore of {} is {}", job.getKey(), updated.getStatus());
                } else {
                    restoreJobService.submitRequest(job.getKey());
                }
            } catch (TransferException e) {
                log.warn("Status check for {} failed, retrying next tick: {}", job.getKey(), e.getMessage());
            } catch (RuntimeException e) {
                log.warn("Unexpected error polling {}, retrying next tick", job.getKey(), e);
            }
        }
    }
}
