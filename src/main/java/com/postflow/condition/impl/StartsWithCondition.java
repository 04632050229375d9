package com.postflow.condition.impl;

import com.postflow.condition.Condition;
import com.postflow.core.Event;
import com.postflow.rule.ConditionType;
import com.postflow.variable.VariableResolver;

/**
 * Condition that checks if a string field starts with a prefix.
 */
public class StartsWithCondition implements Condition {

    private final String field;
    private final String prefix;
    private final VariableResolver resolver;

    public StartsWithCondition(String field, String prefix, VariableResolver resolver) {
        this.field = field;
        this.prefix = prefix;
        this.resolver = resolver;
    }

    @Override
    public boolean evaluate(Event event) {
        String value = resolver.resolveAsString(field, event);
        return value != null && value.startsWith(prefix);
    }

    @Override
    public ConditionType getType() {
        return ConditionType.STARTS_WITH;
    }

    @Override
    public String toString() {
        return field + " STARTS_WITH '" + prefix + "'";
    }
}
