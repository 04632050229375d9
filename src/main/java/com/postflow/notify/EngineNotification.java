package com.postflow.notify;

import com.postflow.job.JobSnapshot;
import com.postflow.job.JobState;

import java.time.Instant;
import java.util.Map;

/**
 * Push message for UI clients.
 *
 * @param type          What happened
 * @param timestamp     When it happened
 * @param job           Job after the change, for JOB_STATE_CHANGED
 * @param previousState State before the change, null for new jobs
 * @param details       Extra facts, e.g. {@code cleared} count or bulk totals
 */
public record EngineNotification(
        NotificationType type,
        Instant timestamp,
        JobSnapshot job,
        JobState previousState,
        Map<String, Object> details
) {
    public EngineNotification {
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    public static EngineNotification jobChanged(JobSnapshot job, JobState previous, Instant now) {
        return new EngineNotification(NotificationType.JOB_STATE_CHANGED, now, job, previous, Map.of());
    }

    public static EngineNotification queue(NotificationType type, Instant now, Map<String, Object> details) {
        return new EngineNotification(type, now, null, null, details);
    }
}
