package com.postflow.condition.impl;

import com.postflow.condition.Condition;
import com.postflow.core.Event;
import com.postflow.rule.ConditionType;
import com.postflow.variable.VariableResolver;

/**
 * Condition that checks if a field is present in the event.
 */
public class ExistsCondition implements Condition {

    private final String field;
    private final VariableResolver resolver;

    public ExistsCondition(String field, VariableResolver resolver) {
        this.field = field;
        this.resolver = resolver;
    }

    @Override
    public boolean evaluate(Event event) {
        return resolver.resolve(field, event).isPresent();
    }

    @Override
    public ConditionType getType() {
        return ConditionType.EXISTS;
    }

    @Override
    public String toString() {
        return field + " EXISTS";
    }
}
