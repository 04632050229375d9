package com.postflow.guardrail;

import com.postflow.rule.GuardrailType;

/**
 * A parameterized live precondition. Pure function of its parameters and a live-state snapshot.
 */
public interface Guardrail {

    /**
     * Check the guardrail against a snapshot.
     *
     * @param state Live state; facts the guardrail needs may be missing
     * @return allow, or block with this guardrail's reason and retry delay
     */
    GuardrailDecision check(LiveState state);

    GuardrailType getType();
}
