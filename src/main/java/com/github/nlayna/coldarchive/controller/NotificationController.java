package com.github.nlayna.coldarchive.controller;

import com.github.nlayna.coldarchive.model.Notification;
import com.github.nlayna.coldarchive.service.NotificationHub;
import com.github.nlayna.coldarchive.service.ProgressListener;
import com.github.nlayna.coldarchive.service.StatusListener;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/v1/notifications")
@RequiredArgsConstructor
public class NotificationController {

    private static final long STREAM_TIMEOUT_MS = 30 * 60 * 1000L;

    private final NotificationHub notificationHub;

    @GetMapping
    public List<Notification> recent() {
        return notificationHub.getRecentNotifications();
    }

    /**
     * Streams {@code progress} and {@code status} events until the client goes away.
     */
    @GetMapping("/stream")
    public SseEmitter stream() {
        SseEmitter emitter = new SseEmitter(STREAM_TIMEOUT_MS);

        ProgressListener progressListener = update -> send(emitter, "progress", update);
        StatusListener statusListener = notification -> send(emitter, "status", notification);
        notificationHub.subscribeProgress(progressListener);
        notificationHub.subscribeStatus(statusListener);

        Runnable unsubscribe = () -> {
            notificationHub.unsubscribeProgress(progressListener);
            notificationHub.unsubscribeStatus(statusListener);
        };
        emitter.onCompletion(unsubscribe);
        emitter.onTimeout(unsubscribe);
        emitter.onError(e -> unsubscribe.run());
        return emitter;
    }

    private static void send(SseEmitter emitter, String eventName, Object payload) {
        try {
            emitter.send(SseEmitter.event().name(eventName).data(payload));
        } catch (IOException | IllegalStateException e) {
            log.debug("Dropping closed notification stream: {}", e.getMessage());
            emitter.completeWithError(e);
        }
    }
}
