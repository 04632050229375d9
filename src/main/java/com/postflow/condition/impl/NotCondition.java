package com.postflow.condition.impl;

import com.postflow.condition.Condition;
import com.postflow.core.Event;
import com.postflow.rule.ConditionType;

/**
 * Negates a nested condition; backs the not_equals and not_contains types.
 */
public class NotCondition implements Condition {

    private final Condition condition;
    private final ConditionType type;

    public NotCondition(Condition condition, ConditionType type) {
        this.condition = condition;
        this.type = type;
    }

    @Override
    public boolean evaluate(Event event) {
        return !condition.evaluate(event);
    }

    @Override
    public ConditionType getType() {
        return type;
    }

    @Override
    public String toString() {
        return "NOT(" + condition + ")";
    }
}
