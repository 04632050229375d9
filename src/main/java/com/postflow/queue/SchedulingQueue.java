package com.postflow.queue;

import com.postflow.exception.JobStateException;
import com.postflow.exception.TaskRejectedException;
import com.postflow.job.Job;
import com.postflow.job.JobSnapshot;
import com.postflow.job.JobState;
import com.postflow.job.JobTransitionListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;

/**
 * Priority queue of ready jobs with a fixed number of execution slots.
 * <p>
 * Ready jobs are ordered by priority (highest first), then creation time, then
 * submission order. At most {@code maxConcurrency} jobs run at once; a cancelled
 * running job keeps its slot until its executor returns.
 * <p>
 * All methods must be called on the engine thread. Executors run on the worker pool
 * and their completions are posted back through the engine executor.
 */
public class SchedulingQueue {

    private static final Logger log = LoggerFactory.getLogger(SchedulingQueue.class);

    private static final Comparator<Entry> READY_ORDER = Comparator
            .<Entry>comparingInt(entry -> entry.job().getPriority()).reversed()
            .thenComparing(entry -> entry.job().getCreatedAt())
            .thenComparingLong(Entry::sequence);

    private final JobExecutor jobExecutor;
    private final ExecutorService workerPool;
    private final Executor engineExecutor;
    private final Clock clock;
    private final int maxConcurrency;
    private final int capacity;
    private final JobTransitionListener transitionListener;

    private final PriorityQueue<Entry> ready = new PriorityQueue<>(READY_ORDER);
    private final Map<String, Running> running = new HashMap<>();
    private long sequence;
    private boolean paused;

    /**
     * @param capacity maximum ready jobs, 0 for unbounded
     */
    public SchedulingQueue(JobExecutor jobExecutor, ExecutorService workerPool, Executor engineExecutor,
                           Clock clock, int maxConcurrency, int capacity,
                           JobTransitionListener transitionListener) {
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("maxConcurrency must be >= 1: " + maxConcurrency);
        }
        this.jobExecutor = jobExecutor;
        this.workerPool = workerPool;
        this.engineExecutor = engineExecutor;
        this.clock = clock;
        this.maxConcurrency = maxConcurrency;
        this.capacity = capacity;
        this.transitionListener = transitionListener;
    }

    /**
     * Add a QUEUED job and start it if a slot is free.
     *
     * @throws TaskRejectedException if the queue is at capacity
     */
    public void submit(Job job) {
        if (job.getState() != JobState.QUEUED) {
            throw new JobStateException(job.getId(), job.getState(), "enqueue");
        }
        if (isFull()) {
            throw new TaskRejectedException("Queue is full, job rejected: " + job.getId());
        }
        ready.add(new Entry(job, sequence++));
        log.debug("Job {} queued with priority {} (queue size: {})", job.getId(), job.getPriority(), ready.size());
        dispatchReady();
    }

    /**
     * Cancel a queued, running or deferred job.
     */
    public void cancel(Job job) {
        JobState previous = job.getState();
        switch (previous) {
            case QUEUED -> {
                ready.removeIf(entry -> entry.job() == job);
                job.cancel(clock.instant());
            }
            case RUNNING -> {
                job.cancel(clock.instant());
                Running run = running.get(job.getId());
                if (run != null) {
                    run.signal().cancel();
                }
            }
            case DEFERRED -> job.cancel(clock.instant());
            default -> throw new JobStateException(job.getId(), previous, "cancel");
        }
        log.info("Job {} cancelled (was {})", job.getId(), previous);
        notifyTransition(job, previous);
    }

    /**
     * Re-queue a failed job. A full queue leaves the job FAILED.
     *
     * @throws TaskRejectedException if the queue is at capacity
     */
    public void retry(Job job) {
        if (job.getState() == JobState.FAILED && isFull()) {
            throw new TaskRejectedException("Queue is full, retry rejected: " + job.getId());
        }
        job.retry();
        notifyTransition(job, JobState.FAILED);
        submit(job);
    }

    public void pause() {
        paused = true;
    }

    public void resume() {
        paused = false;
        dispatchReady();
    }

    public boolean isPaused() {
        return paused;
    }

    /**
     * Cancel every job waiting in the queue. Running jobs are untouched.
     *
     * @return number of jobs cancelled
     */
    public int clearQueued() {
        List<Entry> drained = new ArrayList<>(ready);
        ready.clear();
        for (Entry entry : drained) {
            entry.job().cancel(clock.instant());
            notifyTransition(entry.job(), JobState.QUEUED);
        }
        return drained.size();
    }

    /**
     * Ready jobs in the order they would start.
     */
    public List<JobSnapshot> readyJobs() {
        List<Entry> ordered = new ArrayList<>(ready);
        ordered.sort(READY_ORDER);
        List<JobSnapshot> result = new ArrayList<>(ordered.size());
        for (Entry entry : ordered) {
            result.add(entry.job().snapshot());
        }
        return result;
    }

    public boolean isFull() {
        return capacity > 0 && ready.size() >= capacity;
    }

    public int size() {
        return ready.size();
    }

    public int runningCount() {
        return running.size();
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    /**
     * Raise the cancellation signal of every running job. Used at shutdown.
     */
    public void signalAllRunning() {
        for (Running run : running.values()) {
            run.signal().cancel();
        }
    }

    private void dispatchReady() {
        while (!paused && running.size() < maxConcurrency && !ready.isEmpty()) {
            start(ready.poll().job());
        }
    }

    private void start(Job job) {
        job.start(clock.instant());
        notifyTransition(job, JobState.QUEUED);

        CancellationSignal signal = new CancellationSignal();
        running.put(job.getId(), new Running(job, signal));
        JobSnapshot snapshot = job.snapshot();
        log.debug("Job {} started ({} running)", job.getId(), running.size());

        CompletableFuture
                .supplyAsync(() -> jobExecutor.execute(snapshot, signal), workerPool)
                .thenCompose(future -> future)
                .whenCompleteAsync((outcome, error) -> finish(job, outcome, error), engineExecutor);
    }

    private void finish(Job job, ExecutionOutcome outcome, Throwable error) {
        running.remove(job.getId());
        if (job.getState() == JobState.RUNNING) {
            if (error != null) {
                Throwable cause = error instanceof CompletionException && error.getCause() != null
                        ? error.getCause() : error;
                log.error("Job {} failed: {}", job.getId(), cause.getMessage(), cause);
                job.fail(cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName(),
                        clock.instant());
            } else if (outcome == null || !outcome.success()) {
                String message = outcome == null ? "executor returned no outcome" : outcome.error();
                log.error("Job {} failed: {}", job.getId(), message);
                job.fail(message, clock.instant());
            } else {
                job.complete(clock.instant());
                log.debug("Job {} completed", job.getId());
            }
            notifyTransition(job, JobState.RUNNING);
        } else {
            log.debug("Job {} returned after leaving RUNNING (now {})", job.getId(), job.getState());
        }
        dispatchReady();
    }

    private void notifyTransition(Job job, JobState previous) {
        if (transitionListener != null) {
            transitionListener.onTransition(job.snapshot(), previous);
        }
    }

    private record Entry(Job job, long sequence) {
    }

    private record Running(Job job, CancellationSignal signal) {
    }
}
