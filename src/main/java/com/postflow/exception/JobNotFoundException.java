package com.postflow.exception;

/**
 * Exception thrown when a job id does not refer to a known job.
 */
public class JobNotFoundException extends PostflowException {

    private final String jobId;

    public JobNotFoundException(String jobId) {
        super("Job not found: " + jobId);
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}
