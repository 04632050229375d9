package com.postflow.condition.impl;

import com.postflow.condition.Condition;
import com.postflow.core.Event;
import com.postflow.rule.ConditionType;
import com.postflow.variable.VariableResolver;

import java.math.BigDecimal;

/**
 * Exact match between a resolved field and a literal.
 * Numbers match by value regardless of boxing type; anything else falls back to its text form.
 * A missing field never matches.
 */
public class EqualsCondition implements Condition {

    private final String field;
    private final Object literal;
    private final VariableResolver resolver;

    public EqualsCondition(String field, Object literal, VariableResolver resolver) {
        this.field = field;
        this.literal = literal;
        this.resolver = resolver;
    }

    @Override
    public boolean evaluate(Event event) {
        return resolver.resolve(field, event)
                .map(value -> sameValue(value, literal))
                .orElse(false);
    }

    static boolean sameValue(Object value, Object literal) {
        if (value == null || literal == null) {
            return value == literal;
        }
        if (value instanceof Number && literal instanceof Number) {
            return decimal((Number) value).compareTo(decimal((Number) literal)) == 0;
        }
        return value.equals(literal) || value.toString().equals(literal.toString());
    }

    private static BigDecimal decimal(Number number) {
        if (number instanceof BigDecimal) {
            return (BigDecimal) number;
        }
        if (number instanceof Double || number instanceof Float) {
            return BigDecimal.valueOf(number.doubleValue());
        }
        return BigDecimal.valueOf(number.longValue());
    }

    @Override
    public ConditionType getType() {
        return ConditionType.EQUALS;
    }

    @Override
    public String toString() {
        return field + " == " + literal;
    }
}
