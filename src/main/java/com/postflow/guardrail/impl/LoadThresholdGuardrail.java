package com.postflow.guardrail.impl;

import com.postflow.guardrail.LiveState;
import com.postflow.rule.GuardrailType;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Function;

/**
 * Blocks while CPU or GPU load is above a percentage threshold.
 */
public class LoadThresholdGuardrail extends AbstractGuardrail {

    private final double thresholdPercent;
    private final String reason;
    private final Function<LiveState, Double> load;

    private LoadThresholdGuardrail(GuardrailType type, double thresholdPercent, String reason,
                                   Function<LiveState, Double> load,
                                   Duration retryDelay, Duration unavailableDelay) {
        super(type, retryDelay, unavailableDelay);
        this.thresholdPercent = thresholdPercent;
        this.reason = reason;
        this.load = load;
    }

    public static LoadThresholdGuardrail cpu(double thresholdPercent, Duration retryDelay, Duration unavailableDelay) {
        return new LoadThresholdGuardrail(GuardrailType.PAUSE_IF_CPU_PCT_ABOVE, thresholdPercent, "cpu_busy",
                LiveState::cpuPercent, retryDelay, unavailableDelay);
    }

    public static LoadThresholdGuardrail gpu(double thresholdPercent, Duration retryDelay, Duration unavailableDelay) {
        return new LoadThresholdGuardrail(GuardrailType.PAUSE_IF_GPU_PCT_ABOVE, thresholdPercent, "gpu_busy",
                LiveState::gpuPercent, retryDelay, unavailableDelay);
    }

    @Override
    protected Optional<Boolean> isBlocked(LiveState state) {
        return Optional.ofNullable(load.apply(state)).map(value -> value > thresholdPercent);
    }

    @Override
    protected String reason() {
        return reason;
    }
}
