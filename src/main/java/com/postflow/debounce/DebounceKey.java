package com.postflow.debounce;

/**
 * Debounce timers are kept per rule and subject asset.
 */
public record DebounceKey(String ruleId, String subjectId) {
}
