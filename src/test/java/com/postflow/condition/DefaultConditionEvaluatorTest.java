package com.postflow.condition;

import com.postflow.core.Event;
import com.postflow.rule.ConditionSpec;
import com.postflow.rule.ConditionType;
import com.postflow.rule.TriggerType;
import com.postflow.variable.DefaultVariableResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DefaultConditionEvaluator and the condition implementations.
 */
class DefaultConditionEvaluatorTest {

    private ConditionEvaluator evaluator;
    private Event event;

    @BeforeEach
    void setUp() {
        evaluator = new DefaultConditionEvaluator(new DefaultVariableResolver());
        event = new Event(TriggerType.FILE_CLOSED, "asset-42", Instant.parse("2024-05-03T21:00:00Z"), Map.of(
                "path", "/media/ingest/Show_EP12.MKV",
                "size_bytes", 734003200L,
                "tags", List.of("Raw", "interview"),
                "media", Map.of("codec", "h264", "fps", 59.94)));
    }

    // =====================================================================
    // Comparison
    // =====================================================================

    @Test
    @DisplayName("equals compares numbers across types and strings by value")
    void equalsCondition() {
        assertTrue(eval(ConditionType.EQUALS, Map.of("field", "media.codec", "value", "h264")));
        assertTrue(eval(ConditionType.EQUALS, Map.of("field", "size_bytes", "value", 734003200.0)));
        assertFalse(eval(ConditionType.EQUALS, Map.of("field", "media.codec", "value", "hevc")));
        assertFalse(eval(ConditionType.EQUALS, Map.of("field", "missing", "value", "x")));
    }

    @Test
    @DisplayName("not_equals negates equals, including for missing fields")
    void notEqualsCondition() {
        assertTrue(eval(ConditionType.NOT_EQUALS, Map.of("field", "media.codec", "value", "hevc")));
        assertFalse(eval(ConditionType.NOT_EQUALS, Map.of("field", "media.codec", "value", "h264")));
        assertTrue(eval(ConditionType.NOT_EQUALS, Map.of("field", "missing", "value", "x")));
    }

    @Test
    @DisplayName("greater_than and less_than are strict and false for missing fields")
    void numericComparison() {
        assertTrue(eval(ConditionType.GREATER_THAN, Map.of("field", "size_bytes", "value", 104857600L)));
        assertFalse(eval(ConditionType.GREATER_THAN, Map.of("field", "size_bytes", "value", 734003200L)));
        assertTrue(eval(ConditionType.LESS_THAN, Map.of("field", "media.fps", "value", 60L)));
        assertFalse(eval(ConditionType.LESS_THAN, Map.of("field", "missing", "value", 60L)));
        assertFalse(eval(ConditionType.GREATER_THAN, Map.of("field", "media.codec", "value", 1L)));
    }

    // =====================================================================
    // String
    // =====================================================================

    @Test
    @DisplayName("String conditions match on the field's text")
    void stringConditions() {
        assertTrue(eval(ConditionType.CONTAINS, Map.of("field", "path", "value", "ingest")));
        assertTrue(eval(ConditionType.CONTAINS, Map.of("field", "tags", "value", "interview")));
        assertTrue(eval(ConditionType.NOT_CONTAINS, Map.of("field", "path", "value", "archive")));
        assertTrue(eval(ConditionType.STARTS_WITH, Map.of("field", "path", "value", "/media/")));
        assertTrue(eval(ConditionType.ENDS_WITH, Map.of("field", "path", "value", ".MKV")));
        assertFalse(eval(ConditionType.ENDS_WITH, Map.of("field", "path", "value", ".mkv")));
        assertTrue(eval(ConditionType.REGEX_MATCH, Map.of("field", "path", "pattern", "EP\\d+")));
        assertFalse(eval(ConditionType.REGEX_MATCH, Map.of("field", "missing", "pattern", ".*")));
    }

    // =====================================================================
    // Existence and membership
    // =====================================================================

    @Test
    @DisplayName("exists checks payload and envelope fields")
    void existsCondition() {
        assertTrue(eval(ConditionType.EXISTS, Map.of("field", "media.codec")));
        assertTrue(eval(ConditionType.EXISTS, Map.of("field", "$event.subject_id")));
        assertFalse(eval(ConditionType.EXISTS, Map.of("field", "media.bitrate")));
    }

    @Test
    @DisplayName("has_tag ignores case")
    void hasTagCondition() {
        assertTrue(eval(ConditionType.HAS_TAG, Map.of("tag", "raw")));
        assertFalse(eval(ConditionType.HAS_TAG, Map.of("tag", "graded")));
    }

    @ParameterizedTest
    @DisplayName("extension_in derives the extension from the path ignoring case and dot")
    @ValueSource(strings = {"mkv", ".mkv", "MKV"})
    void extensionInFromPath(String extension) {
        assertTrue(eval(ConditionType.EXTENSION_IN, Map.of("extensions", List.of("mov", extension))));
    }

    @Test
    @DisplayName("extension_in prefers the ext field and fails without one")
    void extensionInEdgeCases() {
        Event withExt = new Event(TriggerType.FILE_CLOSED, "a", Instant.EPOCH,
                Map.of("ext", "mov", "path", "/media/clip.mkv"));
        Event noExtension = new Event(TriggerType.FILE_CLOSED, "a", Instant.EPOCH,
                Map.of("path", "/media/take.01/README"));
        ConditionSpec mkv = new ConditionSpec(ConditionType.EXTENSION_IN, Map.of("extensions", List.of("mkv")));

        assertFalse(evaluator.evaluate(mkv, withExt));
        assertFalse(evaluator.evaluate(mkv, noExtension));
        assertFalse(evaluator.evaluate(mkv, Event.of(TriggerType.MANUAL, "a", Instant.EPOCH)));
    }

    @Test
    @DisplayName("Envelope variables resolve from the event itself")
    void envelopeVariables() {
        assertTrue(eval(ConditionType.EQUALS, Map.of("field", "$event.trigger", "value", "file_closed")));
        assertTrue(eval(ConditionType.EQUALS, Map.of("field", "$event.subject_id", "value", "asset-42")));
        assertTrue(eval(ConditionType.EQUALS, Map.of("field", "$payload.media.codec", "value", "h264")));
    }

    @Test
    @DisplayName("Created conditions report their type")
    void createdConditionType() {
        Condition condition = evaluator.create(
                new ConditionSpec(ConditionType.NOT_CONTAINS, Map.of("field", "path", "value", "x")));

        assertEquals(ConditionType.NOT_CONTAINS, condition.getType());
    }

    private boolean eval(ConditionType type, Map<String, Object> params) {
        return evaluator.evaluate(new ConditionSpec(type, params), event);
    }
}
