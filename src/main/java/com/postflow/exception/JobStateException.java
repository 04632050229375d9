package com.postflow.exception;

import com.postflow.job.JobState;

/**
 * Exception thrown when an operation is not allowed in the job's current state,
 * e.g. retrying a job that has not failed.
 */
public class JobStateException extends PostflowException {

    private final String jobId;
    private final JobState state;

    public JobStateException(String jobId, JobState state, String operation) {
        super("Cannot " + operation + " job " + jobId + " in state " + state);
        this.jobId = jobId;
        this.state = state;
    }

    public String getJobId() {
        return jobId;
    }

    public JobState getState() {
        return state;
    }
}
