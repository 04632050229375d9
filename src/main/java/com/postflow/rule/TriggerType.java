package com.postflow.rule;

import java.util.Arrays;
import java.util.Optional;

/**
 * Event categories a rule can react to.
 */
public enum TriggerType {
    FILE_CLOSED("file_closed"),
    FILE_CREATED("file_created"),
    FILE_MODIFIED("file_modified"),
    RECORDING_STARTED("recording_started"),
    RECORDING_STOPPED("recording_stopped"),
    SCHEDULE_TICK("schedule_tick"),
    MANUAL("manual");

    private final String wireName;

    TriggerType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<TriggerType> fromWireName(String name) {
        return Arrays.stream(values())
                .filter(t -> t.wireName.equals(name))
                .findFirst();
    }

    /**
     * Resolve a trigger from its wire name.
     *
     * @throws IllegalArgumentException if the name is not a registered trigger
     */
    public static TriggerType of(String name) {
        return fromWireName(name)
                .orElseThrow(() -> new IllegalArgumentException("Unknown trigger type: " + name));
    }
}
