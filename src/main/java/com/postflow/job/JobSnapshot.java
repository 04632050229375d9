package com.postflow.job;

import com.postflow.rule.ActionSpec;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Immutable copy of a job handed to callers, listeners and executors.
 *
 * @param id            Job id
 * @param ruleId        Rule that created the job
 * @param ruleName      Rule display name at creation
 * @param subjectId     Asset the job acts on
 * @param actions       Actions to run, in order
 * @param priority      Inherited rule priority
 * @param state         Current state
 * @param blockedReason Guardrail reason, only while deferred
 * @param nextRunAt     Next recheck, only while deferred
 * @param createdAt     Creation time
 * @param startedAt     Last start time, if it ran
 * @param endedAt       Time it reached a terminal state
 * @param error         Failure message, only when failed
 * @param attempts      Guardrail rechecks that blocked again
 * @param eventPayload  Payload of the triggering event
 */
public record JobSnapshot(
        String id,
        String ruleId,
        String ruleName,
        String subjectId,
        List<ActionSpec> actions,
        int priority,
        JobState state,
        String blockedReason,
        Instant nextRunAt,
        Instant createdAt,
        Instant startedAt,
        Instant endedAt,
        String error,
        int attempts,
        Map<String, Object> eventPayload
) {
}
