package com.postflow.guardrail;

/**
 * Supplies live external state (recording status, load, free space) for guardrails.
 * Implementations should answer quickly; the engine abandons a probe that exceeds
 * its configured timeout and treats it as unavailable.
 */
@FunctionalInterface
public interface LiveStateProvider {

    /**
     * Take a fresh snapshot. Never cached across calls by the engine.
     *
     * @return Current live state, with unknown facts left null
     * @throws RuntimeException if the underlying services cannot be reached
     */
    LiveState snapshot();
}
