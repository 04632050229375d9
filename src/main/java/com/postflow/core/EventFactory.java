package com.postflow.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.postflow.rule.TriggerType;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Map;

/**
 * Factory for creating events from the JSON messages emitted by watchers.
 * <p>
 * Expected shape: {"trigger": "file_closed", "subject_id": "asset-1",
 * "timestamp": "2024-05-03T21:30:00Z", "payload": {...}}. A missing timestamp
 * defaults to the factory clock.
 */
public class EventFactory {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private final Clock clock;

    public EventFactory(Clock clock) {
        this.clock = clock;
    }

    @SuppressWarnings("unchecked")
    public Event fromJson(String json) {
        Map<String, Object> message = parseJson(json);

        Object trigger = message.get("trigger");
        Object subjectId = message.get("subject_id");
        if (trigger == null || subjectId == null) {
            throw new IllegalArgumentException("Event requires 'trigger' and 'subject_id'");
        }

        Instant timestamp = clock.instant();
        Object rawTimestamp = message.get("timestamp");
        if (rawTimestamp != null) {
            try {
                timestamp = Instant.parse(rawTimestamp.toString());
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("Invalid event timestamp: " + rawTimestamp, e);
            }
        }

        Object payload = message.get("payload");
        if (payload != null && !(payload instanceof Map)) {
            throw new IllegalArgumentException("Event payload must be an object");
        }
        return new Event(TriggerType.of(trigger.toString()), subjectId.toString(), timestamp,
                (Map<String, Object>) payload);
    }

    private static Map<String, Object> parseJson(String json) {
        try {
            return objectMapper.readValue(json, new TypeReference<Map<String, Object>>() {});
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON event: " + e.getMessage(), e);
        }
    }
}
