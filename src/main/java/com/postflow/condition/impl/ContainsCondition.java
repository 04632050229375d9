package com.postflow.condition.impl;

import com.postflow.condition.Condition;
import com.postflow.core.Event;
import com.postflow.rule.ConditionType;
import com.postflow.variable.VariableResolver;

import java.util.Collection;
import java.util.Optional;

/**
 * Condition that checks if a string field contains a substring,
 * or a list field contains an element.
 */
public class ContainsCondition implements Condition {

    private final String field;
    private final Object value;
    private final VariableResolver resolver;

    public ContainsCondition(String field, Object value, VariableResolver resolver) {
        this.field = field;
        this.value = value;
        this.resolver = resolver;
    }

    @Override
    public boolean evaluate(Event event) {
        Optional<Object> actual = resolver.resolve(field, event);
        if (actual.isEmpty()) {
            return false;
        }
        Object fieldValue = actual.get();
        if (fieldValue instanceof Collection<?> collection) {
            return collection.stream().anyMatch(item -> String.valueOf(item).equals(String.valueOf(value)));
        }
        return String.valueOf(fieldValue).contains(String.valueOf(value));
    }

    @Override
    public ConditionType getType() {
        return ConditionType.CONTAINS;
    }

    @Override
    public String toString() {
        return field + " CONTAINS " + value;
    }
}
