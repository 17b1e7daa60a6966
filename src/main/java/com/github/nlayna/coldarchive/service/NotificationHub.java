package com.github.nlayna.coldarchive.service;

import com.github.nlayna.coldarchive.config.ArchiveProperties;
import com.github.nlayna.coldarchive.model.Notification;
import com.github.nlayna.coldarchive.model.ProgressUpdate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Fans progress ticks and status notifications out to subscribers. Producers only enqueue;
 * delivery runs on the notification executor, so a slow or failing subscriber never stalls a
 * transfer. When the delivery queue is full, progress ticks are dropped and status notifications
 * are delivered on the publishing thread.
 */
@Slf4j
@Service
public class NotificationHub {

    private final Executor notificationExecutor;
    private final int historySize;
    private final List<ProgressListener> progressListeners = new CopyOnWriteArrayList<>();
    private final List<StatusListener> statusListeners = new CopyOnWriteArrayList<>();
    private final Deque<Notification> recent = new ArrayDeque<>();

    public NotificationHub(@Qualifier("notificationExecutor") Executor notificationExecutor,
                           ArchiveProperties archiveProperties) {
        this.notificationExecutor = notificationExecutor;
        this.historySize = archiveProperties.getNotificationHistorySize();
    }

    public void subscribeProgress(ProgressListener listener) {
        progressListeners.add(listener);
    }

    public void unsubscribeProgress(ProgressListener listener) {
        progressListeners.remove(listener);
    }

    public void subscribeStatus(StatusListener listener) {
        statusListeners.add(listener);
    }

    public void unsubscribeStatus(StatusListener listener) {
        statusListeners.remove(listener);
    }

    public void publishProgress(ProgressUpdate update) {
        if (progressListeners.isEmpty()) {
            return;
        }
        try {
            notificationExecutor.execute(() -> deliverProgress(update));
        } catch (RejectedExecutionException e) {
            // callers may hold the job store lock; a later tick supersedes this one
            log.debug("Delivery queue full, dropping progress tick for {}", update.subject());
        }
    }

    private void deliverProgress(ProgressUpdate update) {
        for (ProgressListener listener : progressListeners) {
            try {
                listener.onProgress(update);
            } catch (Exception e) {
                log.warn("Progress listener failed for {}: {}", update.subject(), e.getMessage(), e);
            }
        }
    }

    public void publish(Notification notification) {
        synchronized (recent) {
            recent.addLast(notification);
            while (recent.size() > historySize) {
                recent.removeFirst();
            }
        }
        log.debug("Notification {} {} {}: {}", notification.source(), notification.subject(),
                notification.status(), notification.message());

        try {
            notificationExecutor.execute(() -> deliverStatus(notification));
        } catch (RejectedExecutionException e) {
            log.warn("Delivery queue full, delivering {} {} on the publishing thread",
                    notification.subject(), notification.status());
            deliverStatus(notification);
        }
    }

    private void deliverStatus(Notification notification) {
        for (StatusListener listener : statusListeners) {
            try {
                listener.onNotification(notification);
            } catch (Exception e) {
                log.warn("Status listener failed for {}: {}", notification.subject(), e.getMessage(), e);
            }
        }
    }

    /**
     * Most recent notifications, oldest first.
     */
    public List<Notification> getRecentNotifications() {
        synchronized (recent) {
            return List.copyOf(recent);
        }
    }
}
