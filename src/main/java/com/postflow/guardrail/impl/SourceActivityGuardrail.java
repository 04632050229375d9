package com.postflow.guardrail.impl;

import com.postflow.guardrail.LiveState;
import com.postflow.rule.GuardrailType;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Function;

/**
 * Blocks while a recording source is recording or streaming.
 */
public class SourceActivityGuardrail extends AbstractGuardrail {

    private final String reason;
    private final Function<LiveState, Boolean> fact;

    private SourceActivityGuardrail(GuardrailType type, String reason, Function<LiveState, Boolean> fact,
                                    Duration retryDelay, Duration unavailableDelay) {
        super(type, retryDelay, unavailableDelay);
        this.reason = reason;
        this.fact = fact;
    }

    public static SourceActivityGuardrail recording(Duration retryDelay, Duration unavailableDelay) {
        return new SourceActivityGuardrail(GuardrailType.PAUSE_IF_RECORDING, "recording",
                LiveState::recording, retryDelay, unavailableDelay);
    }

    public static SourceActivityGuardrail streaming(Duration retryDelay, Duration unavailableDelay) {
        return new SourceActivityGuardrail(GuardrailType.PAUSE_IF_STREAMING, "streaming",
                LiveState::streaming, retryDelay, unavailableDelay);
    }

    @Override
    protected Optional<Boolean> isBlocked(LiveState state) {
        return Optional.ofNullable(fact.apply(state));
    }

    @Override
    protected String reason() {
        return reason;
    }
}
