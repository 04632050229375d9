package com.postflow.recheck;

import com.postflow.exception.JobStateException;
import com.postflow.exception.TaskRejectedException;
import com.postflow.guardrail.GuardrailDecision;
import com.postflow.guardrail.GuardrailEvaluator;
import com.postflow.job.Job;
import com.postflow.job.JobState;
import com.postflow.job.JobStore;
import com.postflow.job.JobTransitionListener;
import com.postflow.queue.SchedulingQueue;
import com.postflow.rule.GuardrailSpec;
import com.postflow.rule.Rule;
import com.postflow.store.RuleStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Re-evaluates guardrails of deferred jobs whose recheck time has come.
 * <p>
 * Guardrails are taken from the current version of the job's rule, or from the job
 * itself when the rule has been deleted. A job whose probe is still outstanding is
 * not picked up again by the next tick. While guardrails keep blocking, the delay
 * before the next recheck doubles with every attempt, up to a ceiling. Must be driven
 * from the engine thread.
 */
public class DeferredJobRecheckLoop {

    private static final Logger log = LoggerFactory.getLogger(DeferredJobRecheckLoop.class);

    private static final int MAX_BACKOFF_DOUBLINGS = 4;

    private static final Comparator<Job> DUE_ORDER = Comparator
            .comparing(Job::getNextRunAt)
            .thenComparing(Job::getCreatedAt)
            .thenComparing(Job::getId);

    private final JobStore jobStore;
    private final RuleStore ruleStore;
    private final GuardrailEvaluator guardrailEvaluator;
    private final SchedulingQueue queue;
    private final Executor engineExecutor;
    private final Clock clock;
    private final Duration maxRetryDelay;
    private final JobTransitionListener transitionListener;
    private final Set<String> inFlight = new HashSet<>();

    public DeferredJobRecheckLoop(JobStore jobStore, RuleStore ruleStore, GuardrailEvaluator guardrailEvaluator,
                                  SchedulingQueue queue, Executor engineExecutor, Clock clock,
                                  Duration maxRetryDelay, JobTransitionListener transitionListener) {
        this.jobStore = jobStore;
        this.ruleStore = ruleStore;
        this.guardrailEvaluator = guardrailEvaluator;
        this.queue = queue;
        this.engineExecutor = engineExecutor;
        this.clock = clock;
        this.maxRetryDelay = maxRetryDelay;
        this.transitionListener = transitionListener;
    }

    /**
     * Run one pass over due deferred jobs, oldest recheck time first.
     */
    public CompletableFuture<RecheckSummary> tick() {
        Instant now = clock.instant();
        List<Job> due = jobStore.find(job -> job.getState() == JobState.DEFERRED
                && !job.getNextRunAt().isAfter(now)
                && !inFlight.contains(job.getId()));
        if (due.isEmpty()) {
            return CompletableFuture.completedFuture(RecheckSummary.empty());
        }
        due.sort(DUE_ORDER);
        log.debug("Rechecking {} deferred job(s)", due.size());

        int[] counts = new int[Result.values().length];
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (Job job : due) {
            inFlight.add(job.getId());
            chain = chain.thenCompose(ignored -> recheckIsolated(job)
                    .thenAccept(result -> counts[result.ordinal()]++));
        }
        return chain.thenApply(ignored -> new RecheckSummary(due.size(),
                counts[Result.PROMOTED.ordinal()],
                counts[Result.REDEFERRED.ordinal()],
                counts[Result.SKIPPED.ordinal()],
                counts[Result.FAILED.ordinal()]));
    }

    /**
     * Delay before the next recheck of a job that is still blocked: the guardrail's
     * delay doubled once per earlier attempt (at most four times), capped at the
     * configured ceiling but never below the guardrail's own delay.
     */
    public Duration backoff(Duration retryDelay, int attempts) {
        Duration grown = retryDelay.multipliedBy(1L << Math.min(Math.max(attempts, 0), MAX_BACKOFF_DOUBLINGS));
        Duration capped = grown.compareTo(maxRetryDelay) > 0 ? maxRetryDelay : grown;
        return capped.compareTo(retryDelay) < 0 ? retryDelay : capped;
    }

    /**
     * Move a deferred job to the queue without checking guardrails.
     * A queued job is left as is.
     *
     * @throws JobStateException for any other state
     */
    public void forceRun(Job job) {
        switch (job.getState()) {
            case QUEUED -> log.debug("Force run of {} ignored: already queued", job.getId());
            case DEFERRED -> {
                log.info("Job {} force-run (was blocked by {})", job.getId(), job.getBlockedReason());
                promote(job);
            }
            default -> throw new JobStateException(job.getId(), job.getState(), "force run");
        }
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    /**
     * Recheck one job. A failure is logged and counted; the job leaves the in-flight
     * set either way, so the next pass picks it up again.
     */
    private CompletableFuture<Result> recheckIsolated(Job job) {
        CompletableFuture<Result> step;
        try {
            step = recheck(job);
        } catch (RuntimeException e) {
            step = CompletableFuture.failedFuture(e);
        }
        return step.handleAsync((result, error) -> {
            inFlight.remove(job.getId());
            if (error != null) {
                Throwable cause = error instanceof CompletionException && error.getCause() != null
                        ? error.getCause() : error;
                log.error("Recheck of job {} failed: {}", job.getId(), cause.getMessage(), cause);
                return Result.FAILED;
            }
            return result;
        }, engineExecutor);
    }

    private CompletableFuture<Result> recheck(Job job) {
        if (job.getState() != JobState.DEFERRED) {
            return CompletableFuture.completedFuture(Result.SKIPPED);
        }
        List<GuardrailSpec> guardrails = ruleStore.getRule(job.getRuleId())
                .map(Rule::guardrails)
                .orElse(job.getGuardrails());
        return guardrailEvaluator.evaluate(guardrails, queue.size(), queue.runningCount())
                .thenApplyAsync(decision -> apply(job, decision), engineExecutor);
    }

    private Result apply(Job job, GuardrailDecision decision) {
        if (job.getState() != JobState.DEFERRED) {
            log.debug("Job {} left DEFERRED during recheck (now {})", job.getId(), job.getState());
            return Result.SKIPPED;
        }
        if (decision.isBlocked()) {
            Instant next = clock.instant().plus(backoff(decision.getRetryDelay(), job.getAttempts()));
            job.redefer(decision.getReason(), next);
            transitionListener.onTransition(job.snapshot(), JobState.DEFERRED);
            log.debug("Job {} still blocked: {} (attempt {}, next check {})", job.getId(),
                    decision.getReason(), job.getAttempts(), next);
            return Result.REDEFERRED;
        }
        log.info("Job {} guardrails cleared after {} recheck(s), queuing", job.getId(), job.getAttempts());
        promote(job);
        return Result.PROMOTED;
    }

    private void promote(Job job) {
        job.promote();
        transitionListener.onTransition(job.snapshot(), JobState.DEFERRED);
        try {
            queue.submit(job);
        } catch (TaskRejectedException e) {
            log.warn("Job {} rejected on promotion: {}", job.getId(), e.getMessage());
            job.fail("queue_full", clock.instant());
            transitionListener.onTransition(job.snapshot(), JobState.QUEUED);
        }
    }

    private enum Result {
        PROMOTED,
        REDEFERRED,
        SKIPPED,
        FAILED
    }
}
