package com.postflow.guardrail;

import com.postflow.guardrail.impl.LoadThresholdGuardrail;
import com.postflow.guardrail.impl.MaxConcurrentJobsGuardrail;
import com.postflow.guardrail.impl.MaxQueueDepthGuardrail;
import com.postflow.guardrail.impl.MinFreeSpaceGuardrail;
import com.postflow.guardrail.impl.SourceActivityGuardrail;
import com.postflow.rule.GuardrailSpec;

import java.time.Duration;

/**
 * Creates guardrail instances from compiled rule guardrails.
 */
public class GuardrailFactory {

    private final Duration defaultRetryDelay;

    public GuardrailFactory(Duration defaultRetryDelay) {
        this.defaultRetryDelay = defaultRetryDelay;
    }

    public Guardrail create(GuardrailSpec spec) {
        Duration retryDelay = spec.retryDelay().orElse(defaultRetryDelay);
        return switch (spec.type()) {
            case PAUSE_IF_RECORDING -> SourceActivityGuardrail.recording(retryDelay, defaultRetryDelay);
            case PAUSE_IF_STREAMING -> SourceActivityGuardrail.streaming(retryDelay, defaultRetryDelay);
            case PAUSE_IF_CPU_PCT_ABOVE -> LoadThresholdGuardrail.cpu(
                    spec.numberParam("threshold"), retryDelay, defaultRetryDelay);
            case PAUSE_IF_GPU_PCT_ABOVE -> LoadThresholdGuardrail.gpu(
                    spec.numberParam("threshold"), retryDelay, defaultRetryDelay);
            case MIN_FREE_SPACE_GB -> new MinFreeSpaceGuardrail(
                    spec.numberParam("min_gb"), spec.stringParam("path").orElse(null),
                    retryDelay, defaultRetryDelay);
            case MAX_CONCURRENT_JOBS -> new MaxConcurrentJobsGuardrail(
                    (int) spec.numberParam("max"), retryDelay, defaultRetryDelay);
            case MAX_QUEUE_DEPTH -> new MaxQueueDepthGuardrail(
                    (int) spec.numberParam("max"), retryDelay, defaultRetryDelay);
        };
    }

    public Duration getDefaultRetryDelay() {
        return defaultRetryDelay;
    }
}
