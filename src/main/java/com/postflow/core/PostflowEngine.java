package com.postflow.core;

import com.postflow.compiler.CompilationResult;
import com.postflow.dispatch.DispatchReport;
import com.postflow.dispatch.EvaluationTrace;
import com.postflow.job.BulkResult;
import com.postflow.job.JobFilter;
import com.postflow.job.JobSnapshot;
import com.postflow.job.JobSort;
import com.postflow.job.Page;
import com.postflow.job.PageRequest;
import com.postflow.notify.EngineListener;
import com.postflow.recheck.RecheckSummary;
import com.postflow.rule.Rule;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Rule-driven scheduling engine for post-production jobs.
 * <p>
 * Events are matched against enabled rules; matching rules wait out their quiet
 * period, respect their active hours and pass their guardrails before a job is
 * queued. Jobs blocked by guardrails are deferred and rechecked periodically.
 * <p>
 * Job operations block until the engine thread has applied them and throw
 * {@link com.postflow.exception.JobNotFoundException} or
 * {@link com.postflow.exception.JobStateException} when they cannot be applied.
 * They must not be called from a listener.
 */
public interface PostflowEngine {

    /**
     * Start the periodic recheck of deferred jobs.
     */
    void start();

    /**
     * Compile a rule document. Pure; the result is not stored.
     */
    CompilationResult compileRule(Map<String, ?> document);

    /**
     * Dry-run a compiled rule against an event at the given instant.
     */
    CompletableFuture<EvaluationTrace> testRule(Rule rule, Event event, Instant asOf);

    /**
     * Compile a draft document and dry-run it.
     *
     * @throws com.postflow.exception.RuleCompilationException if the draft does not compile
     */
    CompletableFuture<EvaluationTrace> testRule(Map<String, ?> draft, Event event, Instant asOf);

    /**
     * Dispatch an event. Events are processed in submission order.
     *
     * @return Future completing once every matching rule has been handled
     * @throws com.postflow.exception.TaskRejectedException if the engine is shut down
     */
    CompletableFuture<DispatchReport> submitEvent(Event event);

    Page<JobSnapshot> listJobs(JobFilter filter, JobSort sort, PageRequest page);

    Optional<JobSnapshot> getJob(String jobId);

    /**
     * Cancel a queued, running or deferred job. Running jobs are signalled cooperatively.
     */
    JobSnapshot cancelJob(String jobId);

    /**
     * Re-queue a failed job.
     */
    JobSnapshot retryJob(String jobId);

    /**
     * Queue a deferred job without checking guardrails. A queued job is returned unchanged.
     */
    JobSnapshot forceRunJob(String jobId);

    /**
     * Purge a job in a terminal state.
     */
    void deleteJob(String jobId);

    BulkResult cancelJobs(List<String> jobIds);

    BulkResult retryJobs(List<String> jobIds);

    BulkResult forceRunJobs(List<String> jobIds);

    BulkResult deleteJobs(List<String> jobIds);

    /**
     * Stop starting new jobs. Running jobs continue.
     */
    void pauseQueue();

    void resumeQueue();

    /**
     * Cancel every queued job.
     *
     * @return Number of jobs cancelled
     */
    int clearQueued();

    /**
     * Run a recheck pass over due deferred jobs now.
     */
    CompletableFuture<RecheckSummary> recheckNow();

    EngineStats getStats();

    void addListener(EngineListener listener);

    void removeListener(EngineListener listener);

    void shutdown();

    boolean isShutdown();

    boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException;
}
