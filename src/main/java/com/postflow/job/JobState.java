package com.postflow.job;

/**
 * Lifecycle state of a job. A job holds exactly one state at a time.
 */
public enum JobState {
    QUEUED,
    RUNNING,
    DEFERRED,
    COMPLETED,
    FAILED,
    CANCELED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELED;
    }

    public String wireName() {
        return name().toLowerCase();
    }
}
