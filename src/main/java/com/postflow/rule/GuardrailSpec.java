package com.postflow.rule;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * A compiled guardrail: registered type plus validated parameters.
 */
public record GuardrailSpec(GuardrailType type, Map<String, Object> params) {

    public GuardrailSpec {
        params = Map.copyOf(params);
    }

    public double numberParam(String name) {
        Object value = params.get(name);
        if (!(value instanceof Number number)) {
            throw new IllegalStateException("Guardrail " + type.wireName() + " has no numeric param " + name);
        }
        return number.doubleValue();
    }

    public Optional<String> stringParam(String name) {
        return Optional.ofNullable(params.get(name)).map(Object::toString);
    }

    /**
     * Retry delay requested by this guardrail, if any.
     */
    public Optional<Duration> retryDelay() {
        Object value = params.get(GuardrailType.RETRY_DELAY_PARAM);
        if (value instanceof Number number) {
            return Optional.of(Duration.ofMillis(Math.round(number.doubleValue() * 1000)));
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return type.wireName() + params;
    }
}
