package com.postflow.rule;

import java.util.List;

/**
 * Declares one parameter of a registered condition, action or guardrail type.
 *
 * @param name          Parameter name as written in rule documents
 * @param kind          Expected value kind
 * @param required      Whether the parameter must be present
 * @param allowedValues Allowed values for {@link ParamKind#ENUM}, empty otherwise
 */
public record ParamSpec(String name, ParamKind kind, boolean required, List<String> allowedValues) {

    public static ParamSpec required(String name, ParamKind kind) {
        return new ParamSpec(name, kind, true, List.of());
    }

    public static ParamSpec optional(String name, ParamKind kind) {
        return new ParamSpec(name, kind, false, List.of());
    }

    public static ParamSpec requiredEnum(String name, String... values) {
        return new ParamSpec(name, ParamKind.ENUM, true, List.of(values));
    }

    public static ParamSpec optionalEnum(String name, String... values) {
        return new ParamSpec(name, ParamKind.ENUM, false, List.of(values));
    }
}
