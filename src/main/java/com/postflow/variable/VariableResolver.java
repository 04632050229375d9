package com.postflow.variable;

import com.postflow.core.Event;

import java.util.Optional;

/**
 * Resolves variable references against an event.
 */
public interface VariableResolver {

    /**
     * Resolve a variable reference.
     *
     * @param reference Variable reference (e.g., "ext", "$payload.size_bytes", "$event.subject_id")
     * @param event     Event being evaluated
     * @return Resolved value, or empty if not found
     */
    Optional<Object> resolve(String reference, Event event);

    /**
     * Resolve a variable as a double value (for comparisons).
     *
     * @return Double value, or empty if not found or not numeric
     */
    Optional<Double> resolveAsDouble(String reference, Event event);

    /**
     * Resolve a variable as a String value.
     *
     * @return String value, or null if not found
     */
    default String resolveAsString(String reference, Event event) {
        return resolve(reference, event)
                .map(Object::toString)
                .orElse(null);
    }
}
