package com.postflow.condition.impl;

import com.postflow.condition.Condition;
import com.postflow.core.Event;
import com.postflow.rule.ConditionType;
import com.postflow.variable.VariableResolver;

import java.util.Optional;

/**
 * Numeric comparison condition (greater_than, less_than).
 */
public class ComparisonCondition implements Condition {

    private final String field;
    private final double threshold;
    private final ConditionType type;
    private final VariableResolver resolver;

    public ComparisonCondition(String field, Number threshold, ConditionType type, VariableResolver resolver) {
        if (type != ConditionType.GREATER_THAN && type != ConditionType.LESS_THAN) {
            throw new IllegalArgumentException("Not a comparison type: " + type);
        }
        this.field = field;
        this.threshold = threshold.doubleValue();
        this.type = type;
        this.resolver = resolver;
    }

    @Override
    public boolean evaluate(Event event) {
        Optional<Double> actual = resolver.resolveAsDouble(field, event);
        if (actual.isEmpty()) {
            return false;
        }
        double value = actual.get();
        return type == ConditionType.GREATER_THAN ? value > threshold : value < threshold;
    }

    @Override
    public ConditionType getType() {
        return type;
    }

    @Override
    public String toString() {
        return field + (type == ConditionType.GREATER_THAN ? " > " : " < ") + threshold;
    }
}
