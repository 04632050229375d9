package com.postflow.guardrail.impl;

import com.postflow.guardrail.LiveState;
import com.postflow.rule.GuardrailType;

import java.time.Duration;
import java.util.Optional;

/**
 * Blocks while at least {@code max} jobs are running.
 */
public class MaxConcurrentJobsGuardrail extends AbstractGuardrail {

    private final int max;

    public MaxConcurrentJobsGuardrail(int max, Duration retryDelay, Duration unavailableDelay) {
        super(GuardrailType.MAX_CONCURRENT_JOBS, retryDelay, unavailableDelay);
        this.max = max;
    }

    @Override
    protected Optional<Boolean> isBlocked(LiveState state) {
        return Optional.ofNullable(state.runningJobs()).map(running -> running >= max);
    }

    @Override
    protected String reason() {
        return "too_many_jobs";
    }
}
