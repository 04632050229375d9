package com.postflow.adapter.executor;

import com.postflow.job.JobSnapshot;
import com.postflow.queue.CancellationSignal;
import com.postflow.queue.ExecutionOutcome;
import com.postflow.queue.JobExecutor;
import com.postflow.rule.ActionSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;

/**
 * Executor that logs each action instead of running it.
 * Used when no real executor is wired in.
 */
public class LoggingJobExecutor implements JobExecutor {

    private static final Logger log = LoggerFactory.getLogger(LoggingJobExecutor.class);

    @Override
    public CompletableFuture<ExecutionOutcome> execute(JobSnapshot job, CancellationSignal signal) {
        for (ActionSpec action : job.actions()) {
            if (signal.isCancelled()) {
                log.info("Job {} cancelled before action {}", job.id(), action.type().wireName());
                return CompletableFuture.completedFuture(ExecutionOutcome.failure("cancelled"));
            }
            log.info("Job {} [{}] {} {}", job.id(), job.subjectId(), action.type().wireName(), action.params());
        }
        return CompletableFuture.completedFuture(ExecutionOutcome.completed());
    }
}
