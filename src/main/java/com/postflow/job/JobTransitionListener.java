package com.postflow.job;

/**
 * Told about every job state change, on the engine thread.
 */
@FunctionalInterface
public interface JobTransitionListener {

    /**
     * @param job      Job after the change
     * @param previous State before the change, null for a new job
     */
    void onTransition(JobSnapshot job, JobState previous);
}
