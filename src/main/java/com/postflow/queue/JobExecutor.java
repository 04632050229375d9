package com.postflow.queue;

import com.postflow.job.JobSnapshot;

import java.util.concurrent.CompletableFuture;

/**
 * Runs a job's actions. Invoked on a worker thread.
 * <p>
 * Execution failures are terminal: the engine marks the job failed and never retries
 * it on its own. Cancellation is cooperative through the signal.
 */
@FunctionalInterface
public interface JobExecutor {

    /**
     * @param job    Job to run, already in RUNNING state
     * @param signal Raised when the job is cancelled while running
     * @return Future completing with the outcome; completing exceptionally fails the job
     */
    CompletableFuture<ExecutionOutcome> execute(JobSnapshot job, CancellationSignal signal);
}
