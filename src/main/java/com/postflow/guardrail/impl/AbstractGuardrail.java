package com.postflow.guardrail.impl;

import com.postflow.guardrail.Guardrail;
import com.postflow.guardrail.GuardrailDecision;
import com.postflow.guardrail.LiveState;
import com.postflow.rule.GuardrailType;

import java.time.Duration;
import java.util.Optional;

/**
 * Shared plumbing for guardrails: retry delays and the unavailable-fact rule.
 */
abstract class AbstractGuardrail implements Guardrail {

    private final GuardrailType type;
    private final Duration retryDelay;
    private final Duration unavailableDelay;

    AbstractGuardrail(GuardrailType type, Duration retryDelay, Duration unavailableDelay) {
        this.type = type;
        this.retryDelay = retryDelay;
        this.unavailableDelay = unavailableDelay;
    }

    @Override
    public final GuardrailDecision check(LiveState state) {
        Optional<Boolean> blocked = isBlocked(state);
        if (blocked.isEmpty()) {
            return GuardrailDecision.probeUnavailable(unavailableDelay);
        }
        return blocked.get() ? GuardrailDecision.block(reason(), retryDelay) : GuardrailDecision.allow();
    }

    /**
     * @return whether the guardrail blocks, or empty if a required fact is missing
     */
    protected abstract Optional<Boolean> isBlocked(LiveState state);

    protected abstract String reason();

    @Override
    public GuardrailType getType() {
        return type;
    }
}
