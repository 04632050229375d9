package com.postflow.core;

import com.postflow.rule.TriggerType;

import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * An incoming file-system or scheduler event about one subject asset.
 * Immutable; nested payload objects are flattened using dot notation
 * (e.g., {"media":{"codec":"h264"}} becomes "media.codec" -> "h264").
 *
 * @param trigger   Event category
 * @param subjectId Asset the event is about
 * @param timestamp When the event happened
 * @param payload   Flattened event data (path, size_bytes, ext, tags, ...)
 */
public record Event(TriggerType trigger, String subjectId, Instant timestamp, Map<String, Object> payload) {

    public Event {
        Objects.requireNonNull(trigger, "trigger");
        Objects.requireNonNull(subjectId, "subjectId");
        Objects.requireNonNull(timestamp, "timestamp");
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(flatten(payload));
    }

    public static Event of(TriggerType trigger, String subjectId, Instant timestamp) {
        return new Event(trigger, subjectId, timestamp, Map.of());
    }

    public Optional<Object> payloadValue(String name) {
        return Optional.ofNullable(payload.get(name));
    }

    private static Map<String, Object> flatten(Map<String, ?> map) {
        Map<String, Object> result = new HashMap<>();
        flattenRecursive("", map, result);
        return result;
    }

    private static void flattenRecursive(String prefix, Map<?, ?> map, Map<String, Object> result) {
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            String key = prefix.isEmpty() ? String.valueOf(entry.getKey()) : prefix + "." + entry.getKey();
            Object value = entry.getValue();
            if (value instanceof Map<?, ?> nested) {
                flattenRecursive(key, nested, result);
            } else if (value instanceof List<?> list) {
                // Lists are kept as-is
                result.put(key, List.copyOf(list));
            } else if (value != null) {
                result.put(key, value);
            }
        }
    }
}
