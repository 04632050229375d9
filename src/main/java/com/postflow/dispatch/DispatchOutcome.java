package com.postflow.dispatch;

/**
 * What the dispatcher did with one matching rule for one event.
 */
public enum DispatchOutcome {
    /** A condition did not hold */
    SKIPPED_CONDITIONS,
    /** Outside the rule's active hours */
    SKIPPED_ACTIVE_HOURS,
    /** Quiet period started or reset; the rule fires later */
    DEBOUNCED,
    /** Guardrails allowed; job queued */
    QUEUED,
    /** Guardrails blocked; job deferred */
    DEFERRED,
    /** Guardrails allowed but the queue was full; job failed */
    REJECTED
}
