package com.github.nlayna.coldarchive.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RestoreJob {
    private String jobId;
    private String key;
    private RestoreTier tier;
    private RestoreStatus status;
    private Instant requestedAt;
    private Instant completedAt;
    private Instant expiresAt;
    private String errorMessage;
    /** Whether the object store has accepted the restore request. */
    private boolean submitted;

    public void transitionTo(RestoreStatus next) {
        if (status.isTerminal() || next == RestoreStatus.NOT_FOUND || next == status) {
            throw new IllegalStateException("Restore of " + key + " cannot move from " + status + " to " + next);
        }
        this.status = next;
    }

    public RestoreJob copy() {
        return toBuilder().build();
    }
}
