package com.postflow.condition;

import com.postflow.core.Event;
import com.postflow.rule.ConditionType;

/**
 * Represents a boolean condition that can be evaluated against an event.
 * Implementations are pure and side-effect free.
 */
public interface Condition {

    /**
     * Evaluate this condition against the given event.
     *
     * @param event Event snapshot
     * @return true if condition matches, false otherwise
     */
    boolean evaluate(Event event);

    /**
     * Get the condition type.
     */
    ConditionType getType();
}
