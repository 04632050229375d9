package com.postflow.condition.impl;

import com.postflow.condition.Condition;
import com.postflow.core.Event;
import com.postflow.rule.ConditionType;
import com.postflow.variable.VariableResolver;

import java.util.Collection;
import java.util.Optional;

/**
 * Condition that checks the event's "tags" list for a tag (case-insensitive).
 */
public class HasTagCondition implements Condition {

    static final String TAGS_FIELD = "tags";

    private final String tag;
    private final VariableResolver resolver;

    public HasTagCondition(String tag, VariableResolver resolver) {
        this.tag = tag;
        this.resolver = resolver;
    }

    @Override
    public boolean evaluate(Event event) {
        Optional<Object> tags = resolver.resolve(TAGS_FIELD, event);
        if (tags.isEmpty() || !(tags.get() instanceof Collection<?> collection)) {
            return false;
        }
        return collection.stream().anyMatch(t -> String.valueOf(t).equalsIgnoreCase(tag));
    }

    @Override
    public ConditionType getType() {
        return ConditionType.HAS_TAG;
    }

    @Override
    public String toString() {
        return "HAS_TAG(" + tag + ")";
    }
}
