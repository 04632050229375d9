package com.postflow.condition;

import com.postflow.core.Event;
import com.postflow.rule.ConditionSpec;

/**
 * Factory and evaluator for conditions.
 */
public interface ConditionEvaluator {

    /**
     * Create a Condition instance from a compiled condition.
     *
     * @param spec Compiled condition
     * @return Condition instance
     */
    Condition create(ConditionSpec spec);

    /**
     * Evaluate a compiled condition directly against an event.
     */
    default boolean evaluate(ConditionSpec spec, Event event) {
        return create(spec).evaluate(event);
    }
}
