package com.postflow.rule;

import java.util.List;

/**
 * Value kinds accepted for condition, action and guardrail parameters.
 */
public enum ParamKind {
    STRING,
    NUMBER,
    BOOLEAN,
    /** String, number or boolean. */
    SCALAR,
    /** String restricted to {@link ParamSpec#allowedValues()}. */
    ENUM,
    STRING_ARRAY;

    /**
     * Check whether a raw document value has this kind.
     */
    public boolean accepts(Object value) {
        return switch (this) {
            case STRING, ENUM -> value instanceof String;
            case NUMBER -> value instanceof Number;
            case BOOLEAN -> value instanceof Boolean;
            case SCALAR -> value instanceof String || value instanceof Number || value instanceof Boolean;
            case STRING_ARRAY -> value instanceof List<?> list
                    && list.stream().allMatch(item -> item instanceof String);
        };
    }

    public String description() {
        return switch (this) {
            case STRING -> "a string";
            case NUMBER -> "a number";
            case BOOLEAN -> "a boolean";
            case SCALAR -> "a string, number or boolean";
            case ENUM -> "one of the allowed values";
            case STRING_ARRAY -> "an array of strings";
        };
    }
}
