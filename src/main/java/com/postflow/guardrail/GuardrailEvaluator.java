package com.postflow.guardrail;

import com.postflow.rule.GuardrailSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Evaluates a rule's guardrails against one fresh live-state snapshot.
 * <p>
 * The snapshot is taken on the probe executor with a bounded timeout. A provider
 * error or timeout blocks with {@code probe_unavailable}; the engine never runs
 * a job on unknown state. Guardrails are checked in order and the first block wins.
 */
public class GuardrailEvaluator {

    private static final Logger log = LoggerFactory.getLogger(GuardrailEvaluator.class);

    private final LiveStateProvider liveStateProvider;
    private final GuardrailFactory guardrailFactory;
    private final Executor probeExecutor;
    private final Duration probeTimeout;

    public GuardrailEvaluator(LiveStateProvider liveStateProvider, GuardrailFactory guardrailFactory,
                              Executor probeExecutor, Duration probeTimeout) {
        this.liveStateProvider = liveStateProvider;
        this.guardrailFactory = guardrailFactory;
        this.probeExecutor = probeExecutor;
        this.probeTimeout = probeTimeout;
    }

    /**
     * Evaluate without queue facts; queue guardrails then block as unavailable.
     */
    public CompletableFuture<GuardrailDecision> evaluate(List<GuardrailSpec> guardrails) {
        return evaluate(guardrails, null, null);
    }

    /**
     * Evaluate with queue depth and running count overlaid on the snapshot.
     */
    public CompletableFuture<GuardrailDecision> evaluate(List<GuardrailSpec> guardrails,
                                                         Integer queueDepth, Integer runningJobs) {
        if (guardrails.isEmpty()) {
            return CompletableFuture.completedFuture(GuardrailDecision.allow());
        }
        return CompletableFuture.supplyAsync(liveStateProvider::snapshot, probeExecutor)
                .orTimeout(probeTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((state, error) -> {
                    if (error != null) {
                        Throwable cause = unwrap(error);
                        if (cause instanceof TimeoutException) {
                            log.warn("Live state probe timed out after {}ms", probeTimeout.toMillis());
                        } else {
                            log.warn("Live state probe failed: {}", cause.getMessage());
                        }
                        return GuardrailDecision.probeUnavailable(guardrailFactory.getDefaultRetryDelay());
                    }
                    LiveState snapshot = state == null ? LiveState.unknown() : state;
                    if (queueDepth != null && runningJobs != null) {
                        snapshot = snapshot.withQueueStats(queueDepth, runningJobs);
                    }
                    return decide(guardrails, snapshot);
                });
    }

    /**
     * Check guardrails in order against a given snapshot.
     */
    public GuardrailDecision decide(List<GuardrailSpec> guardrails, LiveState state) {
        for (GuardrailSpec spec : guardrails) {
            GuardrailDecision decision = guardrailFactory.create(spec).check(state);
            if (decision.isBlocked()) {
                log.debug("Guardrail {} blocked: {}", spec.type().wireName(), decision.getReason());
                return decision;
            }
        }
        return GuardrailDecision.allow();
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
