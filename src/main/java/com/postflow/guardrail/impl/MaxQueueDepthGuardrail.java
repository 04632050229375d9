package com.postflow.guardrail.impl;

import com.postflow.guardrail.LiveState;
import com.postflow.rule.GuardrailType;

import java.time.Duration;
import java.util.Optional;

/**
 * Blocks while at least {@code max} jobs are waiting in the queue.
 */
public class MaxQueueDepthGuardrail extends AbstractGuardrail {

    private final int max;

    public MaxQueueDepthGuardrail(int max, Duration retryDelay, Duration unavailableDelay) {
        super(GuardrailType.MAX_QUEUE_DEPTH, retryDelay, unavailableDelay);
        this.max = max;
    }

    @Override
    protected Optional<Boolean> isBlocked(LiveState state) {
        return Optional.ofNullable(state.queueDepth()).map(depth -> depth >= max);
    }

    @Override
    protected String reason() {
        return "queue_full";
    }
}
