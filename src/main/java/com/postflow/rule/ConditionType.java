package com.postflow.rule;

import java.util.List;

import static com.postflow.rule.ParamSpec.required;

/**
 * Registered condition types. Each one is a pure predicate over an event snapshot.
 */
public enum ConditionType implements RegisteredType {
    // Comparison
    EQUALS("equals", List.of(required("field", ParamKind.STRING), required("value", ParamKind.SCALAR))),
    NOT_EQUALS("not_equals", List.of(required("field", ParamKind.STRING), required("value", ParamKind.SCALAR))),
    GREATER_THAN("greater_than", List.of(required("field", ParamKind.STRING), required("value", ParamKind.NUMBER))),
    LESS_THAN("less_than", List.of(required("field", ParamKind.STRING), required("value", ParamKind.NUMBER))),

    // String
    CONTAINS("contains", List.of(required("field", ParamKind.STRING), required("value", ParamKind.STRING))),
    NOT_CONTAINS("not_contains", List.of(required("field", ParamKind.STRING), required("value", ParamKind.STRING))),
    STARTS_WITH("starts_with", List.of(required("field", ParamKind.STRING), required("value", ParamKind.STRING))),
    ENDS_WITH("ends_with", List.of(required("field", ParamKind.STRING), required("value", ParamKind.STRING))),
    REGEX_MATCH("regex_match", List.of(required("field", ParamKind.STRING), required("pattern", ParamKind.STRING))),

    // Existence and membership
    EXISTS("exists", List.of(required("field", ParamKind.STRING))),
    HAS_TAG("has_tag", List.of(required("tag", ParamKind.STRING))),
    EXTENSION_IN("extension_in", List.of(required("extensions", ParamKind.STRING_ARRAY)));

    private final String wireName;
    private final List<ParamSpec> params;

    ConditionType(String wireName, List<ParamSpec> params) {
        this.wireName = wireName;
        this.params = params;
    }

    @Override
    public String wireName() {
        return wireName;
    }

    @Override
    public List<ParamSpec> params() {
        return params;
    }
}
