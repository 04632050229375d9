package com.postflow.rule;

import java.util.Map;

/**
 * A compiled action. The engine never interprets it; the executor does.
 */
public record ActionSpec(ActionType type, Map<String, Object> params) {

    public ActionSpec {
        params = Map.copyOf(params);
    }

    @Override
    public String toString() {
        return type.wireName() + params;
    }
}
