package com.postflow.guardrail;

import java.time.Duration;
import java.util.Objects;

/**
 * Outcome of guardrail evaluation: allow, or block with a reason and a suggested retry delay.
 */
public final class GuardrailDecision {

    public static final String PROBE_UNAVAILABLE = "probe_unavailable";

    private static final GuardrailDecision ALLOW = new GuardrailDecision(true, null, Duration.ZERO);

    private final boolean allowed;
    private final String reason;
    private final Duration retryDelay;

    private GuardrailDecision(boolean allowed, String reason, Duration retryDelay) {
        this.allowed = allowed;
        this.reason = reason;
        this.retryDelay = retryDelay;
    }

    public static GuardrailDecision allow() {
        return ALLOW;
    }

    public static GuardrailDecision block(String reason, Duration retryDelay) {
        Objects.requireNonNull(reason, "reason");
        Objects.requireNonNull(retryDelay, "retryDelay");
        return new GuardrailDecision(false, reason, retryDelay);
    }

    public static GuardrailDecision probeUnavailable(Duration retryDelay) {
        return block(PROBE_UNAVAILABLE, retryDelay);
    }

    public boolean isAllowed() {
        return allowed;
    }

    public boolean isBlocked() {
        return !allowed;
    }

    /**
     * Block reason, null when allowed.
     */
    public String getReason() {
        return reason;
    }

    public Duration getRetryDelay() {
        return retryDelay;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GuardrailDecision that)) return false;
        return allowed == that.allowed
                && Objects.equals(reason, that.reason)
                && retryDelay.equals(that.retryDelay);
    }

    @Override
    public int hashCode() {
        return Objects.hash(allowed, reason, retryDelay);
    }

    @Override
    public String toString() {
        return allowed ? "allow" : "block(" + reason + ", " + retryDelay + ")";
    }
}
