package com.github.nlayna.coldarchive.controller;

import com.github.nlayna.coldarchive.model.Notification;
import com.github.nlayna.coldarchive.model.NotificationSource;
import com.github.nlayna.coldarchive.model.NotificationStatus;
import com.github.nlayna.coldarchive.service.NotificationHub;
import com.github.nlayna.coldarchive.service.ProgressListener;
import com.github.nlayna.coldarchive.service.StatusListener;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(NotificationController.class)
class NotificationControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private NotificationHub notificationHub;

    @Test
    void recent_returnsHistoryOldestFirst() throws Exception {
        when(notificationHub.getRecentNotifications()).thenReturn(List.of(
                new Notification("job-1", NotificationSource.UPLOAD, NotificationStatus.COMPLETED,
                        "Uploaded clip.mov to uploads/clip.mov", Instant.parse("2024-03-07T10:15:30Z")),
                new Notification("uploads/clip.mov", NotificationSource.RESTORE, NotificationStatus.REQUESTED,
                        "STANDARD restore of uploads/clip.mov requested", Instant.parse("2024-03-07T10:16:00Z"))));

        mockMvc.perform(get("/api/v1/notifications"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].subject").value("job-1"))
                .andExpect(jsonPath("$[0].status").value("COMPLETED"))
                .andExpect(jsonPath("$[1].source").value("RESTORE"));
    }

    @Test
    void stream_subscribesToBothChannels() throws Exception {
        mockMvc.perform(get("/api/v1/notifications/stream"))
                .andExpect(request().asyncStarted());

        verify(notificationHub).subscribeProgress(any(ProgressListener.class));
        verify(notificationHub).subscribeStatus(any(StatusListener.class));
    }
}
