package com.postflow.core;

import com.postflow.compiler.CompilationResult;
import com.postflow.compiler.RuleCompiler;
import com.postflow.condition.ConditionEvaluator;
import com.postflow.condition.DefaultConditionEvaluator;
import com.postflow.config.EngineSettings;
import com.postflow.debounce.QuietPeriodDebouncer;
import com.postflow.dispatch.DispatchReport;
import com.postflow.dispatch.EvaluationTrace;
import com.postflow.dispatch.TriggerDispatcher;
import com.postflow.exception.InvariantViolationException;
import com.postflow.exception.JobNotFoundException;
import com.postflow.exception.JobStateException;
import com.postflow.exception.PostflowException;
import com.postflow.exception.TaskRejectedException;
import com.postflow.guardrail.GuardrailEvaluator;
import com.postflow.guardrail.GuardrailFactory;
import com.postflow.guardrail.LiveStateProvider;
import com.postflow.job.BulkItem;
import com.postflow.job.BulkResult;
import com.postflow.job.Job;
import com.postflow.job.JobFilter;
import com.postflow.job.JobSnapshot;
import com.postflow.job.JobSort;
import com.postflow.job.JobState;
import com.postflow.job.JobStore;
import com.postflow.job.Page;
import com.postflow.job.PageRequest;
import com.postflow.notify.EngineListener;
import com.postflow.notify.EngineNotification;
import com.postflow.notify.NotificationBus;
import com.postflow.notify.NotificationType;
import com.postflow.queue.JobExecutor;
import com.postflow.queue.SchedulingQueue;
import com.postflow.recheck.DeferredJobRecheckLoop;
import com.postflow.recheck.RecheckSummary;
import com.postflow.rule.Rule;
import com.postflow.store.RuleChangeListener;
import com.postflow.store.RuleStore;
import com.postflow.variable.DefaultVariableResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Default engine: a single engine thread owns every job, the queue and the debounce state.
 * <p>
 * Public operations are posted to the engine thread as commands. Guardrail probes run on
 * a probe pool and job actions on a fixed worker pool; both report back to the engine
 * thread, so state is never touched concurrently.
 */
public class DefaultPostflowEngine implements PostflowEngine {

    private static final Logger log = LoggerFactory.getLogger(DefaultPostflowEngine.class);

    private static final String ENGINE_THREAD_NAME = "postflow-engine";

    private final EngineSettings settings;
    private final Clock clock;
    private final RuleCompiler compiler;
    private final ScheduledExecutorService engineExecutor;
    private final ExecutorService probePool;
    private final ExecutorService workerPool;
    private final NotificationBus notificationBus = new NotificationBus();
    private final JobStore jobStore = new JobStore();
    private final SchedulingQueue queue;
    private final TriggerDispatcher dispatcher;
    private final DeferredJobRecheckLoop recheckLoop;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean shutdown = new AtomicBoolean(false);
    private final AtomicLong eventsReceived = new AtomicLong(0);
    private volatile Thread engineThread;

    public DefaultPostflowEngine(EngineSettings settings, RuleStore ruleStore,
                                 LiveStateProvider liveStateProvider, JobExecutor jobExecutor) {
        this(settings, ruleStore, liveStateProvider, jobExecutor, Clock.system(settings.zoneId()),
                () -> "job-" + UUID.randomUUID());
    }

    public DefaultPostflowEngine(EngineSettings settings, RuleStore ruleStore,
                                 LiveStateProvider liveStateProvider, JobExecutor jobExecutor,
                                 Clock clock, Supplier<String> jobIdGenerator) {
        this.settings = settings;
        this.clock = clock;
        this.compiler = new RuleCompiler(clock);

        ScheduledThreadPoolExecutor engine = new ScheduledThreadPoolExecutor(1, runnable -> {
            Thread thread = new Thread(runnable, ENGINE_THREAD_NAME);
            thread.setDaemon(true);
            engineThread = thread;
            return thread;
        });
        // Pending quiet-period fires die with the engine
        engine.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        this.engineExecutor = engine;
        this.probePool = Executors.newCachedThreadPool(new NamedThreadFactory("postflow-probe-"));
        this.workerPool = Executors.newFixedThreadPool(settings.maxConcurrency(),
                new NamedThreadFactory(settings.workerThreadPrefix()));

        GuardrailEvaluator guardrailEvaluator = new GuardrailEvaluator(liveStateProvider,
                new GuardrailFactory(settings.defaultRetryDelay()), probePool, settings.probeTimeout());
        ConditionEvaluator conditionEvaluator = new DefaultConditionEvaluator(new DefaultVariableResolver());

        this.queue = new SchedulingQueue(jobExecutor, workerPool, engineExecutor, clock,
                settings.maxConcurrency(), settings.queueCapacity(), this::onJobTransition);
        this.dispatcher = new TriggerDispatcher(ruleStore, conditionEvaluator, guardrailEvaluator,
                new QuietPeriodDebouncer<>(), jobStore, queue,
                (task, delay) -> engineExecutor.schedule(guarded(task, "quiet-period fire"),
                        delay.toMillis(), TimeUnit.MILLISECONDS),
                engineExecutor, clock, settings.zoneId(), jobIdGenerator, this::onJobTransition);
        this.recheckLoop = new DeferredJobRecheckLoop(jobStore, ruleStore, guardrailEvaluator, queue,
                engineExecutor, clock, settings.maxRetryDelay(), this::onJobTransition);

        ruleStore.addChangeListener(new RuleChangeListener() {
            @Override
            public void onRuleSaved(Rule rule) {
                if (!rule.enabled()) {
                    dropPendingFires(rule.id());
                }
            }

            @Override
            public void onRuleDeleted(String ruleId) {
                dropPendingFires(ruleId);
            }
        });

        log.info("Postflow engine initialized (maxConcurrency={}, queueCapacity={}, zone={})",
                settings.maxConcurrency(), settings.queueCapacity(), settings.zoneId());
    }

    @Override
    public void start() {
        if (shutdown.get()) {
            throw new TaskRejectedException("Engine is shut down");
        }
        if (!started.compareAndSet(false, true)) {
            return;
        }
        long interval = settings.recheckInterval().toMillis();
        engineExecutor.scheduleWithFixedDelay(guarded(this::runScheduledRecheck, "recheck"),
                interval, interval, TimeUnit.MILLISECONDS);
        log.info("Postflow engine started (recheck every {}s)", settings.recheckIntervalSeconds());
    }

    // ----- rules -----

    @Override
    public CompilationResult compileRule(Map<String, ?> document) {
        return compiler.compile(document);
    }

    @Override
    public CompletableFuture<EvaluationTrace> testRule(Rule rule, Event event, Instant asOf) {
        return onEngine(() -> dispatcher.testRule(rule, event, asOf)).thenCompose(future -> future);
    }

    @Override
    public CompletableFuture<EvaluationTrace> testRule(Map<String, ?> draft, Event event, Instant asOf) {
        return testRule(compiler.compileOrThrow(draft), event, asOf);
    }

    // ----- events -----

    @Override
    public CompletableFuture<DispatchReport> submitEvent(Event event) {
        if (shutdown.get()) {
            throw new TaskRejectedException("Engine is shut down, event rejected: " + event.subjectId());
        }
        eventsReceived.incrementAndGet();
        return onEngine(() -> dispatcher.dispatch(event)).thenCompose(future -> future);
    }

    // ----- jobs -----

    @Override
    public Page<JobSnapshot> listJobs(JobFilter filter, JobSort sort, PageRequest page) {
        JobFilter effectiveFilter = filter != null ? filter : JobFilter.all();
        JobSort effectiveSort = sort != null ? sort : JobSort.CREATED_DESC;
        PageRequest effectivePage = page != null ? page : PageRequest.first(PageRequest.DEFAULT_SIZE);
        List<JobSnapshot> all = await(onEngine(() -> {
            List<JobSnapshot> snapshots = new ArrayList<>();
            for (Job job : jobStore.all()) {
                snapshots.add(job.snapshot());
            }
            return snapshots;
        }));
        List<JobSnapshot> matching = new ArrayList<>();
        for (JobSnapshot job : all) {
            if (effectiveFilter.matches(job)) {
                matching.add(job);
            }
        }
        matching.sort(effectiveSort.comparator());
        return Page.of(matching, effectivePage);
    }

    @Override
    public Optional<JobSnapshot> getJob(String jobId) {
        return await(onEngine(() -> jobStore.get(jobId).map(Job::snapshot)));
    }

    @Override
    public JobSnapshot cancelJob(String jobId) {
        return await(onEngine(() -> doCancel(jobId)));
    }

    @Override
    public JobSnapshot retryJob(String jobId) {
        return await(onEngine(() -> doRetry(jobId)));
    }

    @Override
    public JobSnapshot forceRunJob(String jobId) {
        return await(onEngine(() -> doForceRun(jobId)));
    }

    @Override
    public void deleteJob(String jobId) {
        await(onEngine(() -> doDelete(jobId)));
    }

    @Override
    public BulkResult cancelJobs(List<String> jobIds) {
        return bulk("cancel", jobIds, this::doCancel);
    }

    @Override
    public BulkResult retryJobs(List<String> jobIds) {
        return bulk("retry", jobIds, this::doRetry);
    }

    @Override
    public BulkResult forceRunJobs(List<String> jobIds) {
        return bulk("force_run", jobIds, this::doForceRun);
    }

    @Override
    public BulkResult deleteJobs(List<String> jobIds) {
        return bulk("delete", jobIds, this::doDelete);
    }

    private JobSnapshot doCancel(String jobId) {
        Job job = requireJob(jobId);
        queue.cancel(job);
        return job.snapshot();
    }

    private JobSnapshot doRetry(String jobId) {
        Job job = requireJob(jobId);
        if (job.getState() != JobState.FAILED) {
            throw new JobStateException(jobId, job.getState(), "retry");
        }
        log.info("Job {} retried", jobId);
        queue.retry(job);
        return job.snapshot();
    }

    private JobSnapshot doForceRun(String jobId) {
        Job job = requireJob(jobId);
        recheckLoop.forceRun(job);
        return job.snapshot();
    }

    private JobSnapshot doDelete(String jobId) {
        Job job = requireJob(jobId);
        if (!job.getState().isTerminal()) {
            throw new JobStateException(jobId, job.getState(), "delete");
        }
        jobStore.remove(jobId);
        log.debug("Job {} deleted", jobId);
        return job.snapshot();
    }

    private Job requireJob(String jobId) {
        return jobStore.get(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    private BulkResult bulk(String operation, List<String> jobIds, Function<String, JobSnapshot> action) {
        return await(onEngine(() -> {
            List<BulkItem> items = new ArrayList<>(jobIds.size());
            for (String jobId : jobIds) {
                try {
                    action.apply(jobId);
                    items.add(BulkItem.success(jobId));
                } catch (InvariantViolationException e) {
                    throw e;
                } catch (PostflowException e) {
                    items.add(BulkItem.failure(jobId, e.getMessage()));
                }
            }
            BulkResult result = new BulkResult(operation, items);
            log.info("Bulk {} on {} job(s): {} ok, {} failed", operation, jobIds.size(),
                    result.succeeded(), result.failed());
            notificationBus.publish(EngineNotification.queue(NotificationType.BULK_COMPLETED, clock.instant(),
                    Map.of("operation", operation, "succeeded", result.succeeded(), "failed", result.failed())));
            return result;
        }));
    }

    // ----- queue -----

    @Override
    public void pauseQueue() {
        await(onEngine(() -> {
            queue.pause();
            log.info("Queue paused");
            notificationBus.publish(EngineNotification.queue(NotificationType.QUEUE_PAUSED, clock.instant(), Map.of()));
            return null;
        }));
    }

    @Override
    public void resumeQueue() {
        await(onEngine(() -> {
            log.info("Queue resumed");
            notificationBus.publish(EngineNotification.queue(NotificationType.QUEUE_RESUMED, clock.instant(), Map.of()));
            queue.resume();
            return null;
        }));
    }

    @Override
    public int clearQueued() {
        return await(onEngine(() -> {
            int cleared = queue.clearQueued();
            log.info("Cleared {} queued job(s)", cleared);
            notificationBus.publish(EngineNotification.queue(NotificationType.QUEUE_CLEARED, clock.instant(),
                    Map.of("cleared", cleared)));
            return cleared;
        }));
    }

    @Override
    public CompletableFuture<RecheckSummary> recheckNow() {
        return onEngine(recheckLoop::tick).thenCompose(future -> future);
    }

    @Override
    public EngineStats getStats() {
        return await(onEngine(() -> new EngineStats(
                queue.size(),
                queue.runningCount(),
                jobStore.count(JobState.DEFERRED),
                jobStore.count(JobState.COMPLETED),
                jobStore.count(JobState.FAILED),
                jobStore.count(JobState.CANCELED),
                dispatcher.pendingFires(),
                queue.isPaused(),
                queue.getMaxConcurrency(),
                eventsReceived.get())));
    }

    // ----- notifications -----

    @Override
    public void addListener(EngineListener listener) {
        notificationBus.addListener(listener);
    }

    @Override
    public void removeListener(EngineListener listener) {
        notificationBus.removeListener(listener);
    }

    private void onJobTransition(JobSnapshot job, JobState previous) {
        notificationBus.publish(EngineNotification.jobChanged(job, previous, clock.instant()));
    }

    // ----- lifecycle -----

    @Override
    public void shutdown() {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        log.info("Shutting down Postflow engine");
        try {
            engineExecutor.execute(queue::signalAllRunning);
        } catch (RejectedExecutionException e) {
            log.debug("Engine executor already stopped");
        }
        engineExecutor.shutdown();
        workerPool.shutdown();
        probePool.shutdownNow();
    }

    @Override
    public boolean isShutdown() {
        return shutdown.get();
    }

    @Override
    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        if (!engineExecutor.awaitTermination(timeout, unit)) {
            return false;
        }
        return workerPool.awaitTermination(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
    }

    // ----- engine thread plumbing -----

    private void runScheduledRecheck() {
        recheckLoop.tick().whenComplete((summary, error) -> {
            if (error != null) {
                log.error("Recheck pass failed: {}", error.getMessage(), error);
            } else if (summary.checked() > 0) {
                log.info("Recheck pass: {} checked, {} promoted, {} still blocked, {} failed",
                        summary.checked(), summary.promoted(), summary.redeferred(), summary.failed());
            }
        });
    }

    private void dropPendingFires(String ruleId) {
        if (shutdown.get()) {
            return;
        }
        onEngine(() -> dispatcher.cancelPendingFires(ruleId)).whenComplete((dropped, error) -> {
            if (error != null) {
                log.warn("Could not drop pending fires of rule {}: {}", ruleId, error.getMessage());
            } else if (dropped > 0) {
                log.info("Dropped {} pending quiet-period fire(s) of rule {}", dropped, ruleId);
            }
        });
    }

    /**
     * Run a command on the engine thread. Commands issued from the engine thread run inline.
     */
    private <T> CompletableFuture<T> onEngine(Supplier<T> command) {
        if (Thread.currentThread() == engineThread) {
            try {
                return CompletableFuture.completedFuture(command.get());
            } catch (RuntimeException e) {
                logIfInvariant(e);
                return CompletableFuture.failedFuture(e);
            }
        }
        CompletableFuture<T> result = new CompletableFuture<>();
        try {
            engineExecutor.execute(() -> {
                try {
                    result.complete(command.get());
                } catch (RuntimeException e) {
                    logIfInvariant(e);
                    result.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            result.completeExceptionally(new TaskRejectedException("Engine is shut down", e));
        }
        return result;
    }

    private Runnable guarded(Runnable task, String name) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                logIfInvariant(e);
                log.error("Engine task '{}' failed: {}", name, e.getMessage(), e);
            }
        };
    }

    private static void logIfInvariant(RuntimeException e) {
        if (e instanceof InvariantViolationException) {
            log.error("Invariant violated: {}", e.getMessage(), e);
        }
    }

    private static <T> T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }
}
