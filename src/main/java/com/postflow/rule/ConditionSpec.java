package com.postflow.rule;

import java.util.Map;

/**
 * A compiled condition: registered type plus validated parameters.
 */
public record ConditionSpec(ConditionType type, Map<String, Object> params) {

    public ConditionSpec {
        params = Map.copyOf(params);
    }

    public String stringParam(String name) {
        Object value = params.get(name);
        return value != null ? value.toString() : null;
    }

    @Override
    public String toString() {
        return type.wireName() + params;
    }
}
