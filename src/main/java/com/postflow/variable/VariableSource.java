package com.postflow.variable;

/**
 * Source of variable values referenced by conditions.
 */
public enum VariableSource {
    /**
     * Event payload values ($payload.*). Bare names without a prefix also resolve here.
     */
    PAYLOAD("$payload"),

    /**
     * Event envelope values ($event.subject_id, $event.trigger, $event.timestamp)
     */
    EVENT("$event");

    private final String prefix;

    VariableSource(String prefix) {
        this.prefix = prefix;
    }

    public String getPrefix() {
        return prefix;
    }

    /**
     * Determine the source from a variable reference.
     *
     * @param reference Variable reference (e.g., "$event.subject_id" or "size_bytes")
     * @return The variable source
     * @throws IllegalArgumentException if reference uses an unknown prefix
     */
    public static VariableSource fromReference(String reference) {
        if (reference == null || reference.isEmpty()) {
            throw new IllegalArgumentException("Variable reference cannot be null or empty");
        }
        if (reference.startsWith(EVENT.prefix + ".")) {
            return EVENT;
        }
        if (reference.startsWith(PAYLOAD.prefix + ".") || !reference.startsWith("$")) {
            return PAYLOAD;
        }
        throw new IllegalArgumentException("Invalid variable reference: " + reference +
                ". Must be a payload field or start with $payload. or $event.");
    }

    /**
     * Extract the variable name from a reference.
     *
     * @param reference Variable reference (e.g., "$payload.path")
     * @return The variable name (e.g., "path")
     */
    public static String extractName(String reference) {
        VariableSource source = fromReference(reference);
        if (!reference.startsWith(source.prefix + ".")) {
            return reference;
        }
        return reference.substring(source.prefix.length() + 1);
    }
}
