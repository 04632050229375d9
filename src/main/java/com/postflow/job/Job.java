package com.postflow.job;

import com.postflow.exception.InvariantViolationException;
import com.postflow.exception.JobStateException;
import com.postflow.rule.ActionSpec;
import com.postflow.rule.GuardrailSpec;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Mutable job owned by the engine thread.
 * <p>
 * Every state change goes through a transition method that rejects illegal moves
 * with {@link JobStateException} and re-checks that {@code blockedReason} and
 * {@code nextRunAt} are set exactly when the job is deferred.
 * Callers outside the engine only ever see {@link JobSnapshot}s.
 */
public class Job {

    private final String id;
    private final String ruleId;
    private final String ruleName;
    private final String subjectId;
    private final List<ActionSpec> actions;
    private final int priority;
    private final List<GuardrailSpec> guardrails;
    private final Map<String, Object> eventPayload;
    private final Instant createdAt;

    private JobState state;
    private String blockedReason;
    private Instant nextRunAt;
    private Instant startedAt;
    private Instant endedAt;
    private String error;
    private int attempts;

    private Job(String id, String ruleId, String ruleName, String subjectId, List<ActionSpec> actions,
                int priority, List<GuardrailSpec> guardrails, Map<String, Object> eventPayload,
                Instant createdAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.ruleId = Objects.requireNonNull(ruleId, "ruleId");
        this.ruleName = ruleName;
        this.subjectId = Objects.requireNonNull(subjectId, "subjectId");
        this.actions = List.copyOf(actions);
        this.priority = priority;
        this.guardrails = List.copyOf(guardrails);
        this.eventPayload = eventPayload == null ? Map.of() : Map.copyOf(eventPayload);
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
    }

    /**
     * New job whose guardrails allowed it.
     */
    public static Job queued(JobSpec spec, Instant createdAt) {
        Job job = fromSpec(spec, createdAt);
        job.state = JobState.QUEUED;
        return job;
    }

    /**
     * New job held back by a guardrail.
     */
    public static Job deferred(JobSpec spec, Instant createdAt, String reason, Instant nextRunAt) {
        Job job = fromSpec(spec, createdAt);
        job.state = JobState.DEFERRED;
        job.blockedReason = Objects.requireNonNull(reason, "reason");
        job.nextRunAt = Objects.requireNonNull(nextRunAt, "nextRunAt");
        job.checkInvariants();
        return job;
    }

    private static Job fromSpec(JobSpec spec, Instant createdAt) {
        return new Job(spec.id(), spec.ruleId(), spec.ruleName(), spec.subjectId(), spec.actions(),
                spec.priority(), spec.guardrails(), spec.eventPayload(), createdAt);
    }

    // ----- transitions -----

    public void start(Instant now) {
        require(JobState.QUEUED, "start");
        state = JobState.RUNNING;
        startedAt = now;
        checkInvariants();
    }

    public void complete(Instant now) {
        require(JobState.RUNNING, "complete");
        state = JobState.COMPLETED;
        endedAt = now;
        checkInvariants();
    }

    /**
     * Fail a running job, or a queued one the queue refused to take.
     */
    public void fail(String error, Instant now) {
        if (state != JobState.RUNNING && state != JobState.QUEUED) {
            throw new JobStateException(id, state, "fail");
        }
        state = JobState.FAILED;
        this.error = error == null ? "unknown error" : error;
        endedAt = now;
        checkInvariants();
    }

    public void cancel(Instant now) {
        if (state != JobState.QUEUED && state != JobState.RUNNING && state != JobState.DEFERRED) {
            throw new JobStateException(id, state, "cancel");
        }
        state = JobState.CANCELED;
        blockedReason = null;
        nextRunAt = null;
        endedAt = now;
        checkInvariants();
    }

    /**
     * Guardrails still block: push the recheck time out.
     */
    public void redefer(String reason, Instant nextRunAt) {
        require(JobState.DEFERRED, "defer");
        this.blockedReason = Objects.requireNonNull(reason, "reason");
        this.nextRunAt = Objects.requireNonNull(nextRunAt, "nextRunAt");
        attempts++;
        checkInvariants();
    }

    /**
     * Guardrails cleared, or a force run: back to the ready queue.
     */
    public void promote() {
        require(JobState.DEFERRED, "promote");
        state = JobState.QUEUED;
        blockedReason = null;
        nextRunAt = null;
        checkInvariants();
    }

    public void retry() {
        require(JobState.FAILED, "retry");
        state = JobState.QUEUED;
        error = null;
        startedAt = null;
        endedAt = null;
        checkInvariants();
    }

    private void require(JobState expected, String operation) {
        if (state != expected) {
            throw new JobStateException(id, state, operation);
        }
    }

    /**
     * @throws InvariantViolationException if deferred bookkeeping disagrees with the state
     */
    public void checkInvariants() {
        boolean deferred = state == JobState.DEFERRED;
        if (deferred != (nextRunAt != null) || deferred != (blockedReason != null)) {
            throw new InvariantViolationException("Job " + id + " in state " + state
                    + " has nextRunAt=" + nextRunAt + ", blockedReason=" + blockedReason);
        }
        if ((state == JobState.FAILED) != (error != null)) {
            throw new InvariantViolationException("Job " + id + " in state " + state + " has error=" + error);
        }
    }

    public JobSnapshot snapshot() {
        return new JobSnapshot(id, ruleId, ruleName, subjectId, actions, priority, state, blockedReason,
                nextRunAt, createdAt, startedAt, endedAt, error, attempts, eventPayload);
    }

    // ----- accessors -----

    public String getId() {
        return id;
    }

    public String getRuleId() {
        return ruleId;
    }

    public String getSubjectId() {
        return subjectId;
    }

    public int getPriority() {
        return priority;
    }

    public List<ActionSpec> getActions() {
        return actions;
    }

    /**
     * Guardrails captured when the job was created.
     */
    public List<GuardrailSpec> getGuardrails() {
        return guardrails;
    }

    public JobState getState() {
        return state;
    }

    public String getBlockedReason() {
        return blockedReason;
    }

    public Instant getNextRunAt() {
        return nextRunAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public int getAttempts() {
        return attempts;
    }

    @Override
    public String toString() {
        return "Job{" + id + ", rule=" + ruleId + ", subject=" + subjectId + ", state=" + state + "}";
    }
}
