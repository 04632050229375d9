package com.postflow.condition.impl;

import com.postflow.condition.Condition;
import com.postflow.core.Event;
import com.postflow.rule.ConditionType;
import com.postflow.variable.VariableResolver;

/**
 * Condition that checks if a string field ends with a suffix.
 */
public class EndsWithCondition implements Condition {

    private final String field;
    private final String suffix;
    private final VariableResolver resolver;

    public EndsWithCondition(String field, String suffix, VariableResolver resolver) {
        this.field = field;
        this.suffix = suffix;
        this.resolver = resolver;
    }

    @Override
    public boolean evaluate(Event event) {
        String value = resolver.resolveAsString(field, event);
        return value != null && value.endsWith(suffix);
    }

    @Override
    public ConditionType getType() {
        return ConditionType.ENDS_WITH;
    }

    @Override
    public String toString() {
        return field + " ENDS_WITH '" + suffix + "'";
    }
}
