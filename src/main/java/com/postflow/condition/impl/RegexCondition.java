package com.postflow.condition.impl;

import com.postflow.condition.Condition;
import com.postflow.core.Event;
import com.postflow.rule.ConditionType;
import com.postflow.variable.VariableResolver;

import java.util.regex.Pattern;

/**
 * Condition that checks if a string field contains a match for a regular expression.
 */
public class RegexCondition implements Condition {

    private final String field;
    private final Pattern pattern;
    private final VariableResolver resolver;

    public RegexCondition(String field, String regex, VariableResolver resolver) {
        this.field = field;
        this.pattern = Pattern.compile(regex);
        this.resolver = resolver;
    }

    @Override
    public boolean evaluate(Event event) {
        String value = resolver.resolveAsString(field, event);
        return value != null && pattern.matcher(value).find();
    }

    @Override
    public ConditionType getType() {
        return ConditionType.REGEX_MATCH;
    }

    @Override
    public String toString() {
        return field + " MATCHES /" + pattern.pattern() + "/";
    }
}
