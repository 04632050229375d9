package com.postflow.condition.impl;

import com.postflow.condition.Condition;
import com.postflow.core.Event;
import com.postflow.rule.ConditionType;
import com.postflow.variable.VariableResolver;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Condition that checks the subject's file extension against a set.
 * Uses the "ext" payload field when present, otherwise derives it from "path".
 * Comparison ignores case and a leading dot.
 */
public class ExtensionInCondition implements Condition {

    private final Set<String> extensions;
    private final VariableResolver resolver;

    public ExtensionInCondition(List<String> extensions, VariableResolver resolver) {
        this.extensions = extensions.stream()
                .map(ExtensionInCondition::normalize)
                .collect(Collectors.toUnmodifiableSet());
        this.resolver = resolver;
    }

    @Override
    public boolean evaluate(Event event) {
        String ext = resolver.resolveAsString("ext", event);
        if (ext == null) {
            String path = resolver.resolveAsString("path", event);
            if (path == null) {
                return false;
            }
            int dot = path.lastIndexOf('.');
            int slash = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
            if (dot <= slash) {
                return false;
            }
            ext = path.substring(dot);
        }
        return extensions.contains(normalize(ext));
    }

    private static String normalize(String ext) {
        String trimmed = ext.startsWith(".") ? ext.substring(1) : ext;
        return trimmed.toLowerCase(Locale.ROOT);
    }

    @Override
    public ConditionType getType() {
        return ConditionType.EXTENSION_IN;
    }

    @Override
    public String toString() {
        return "EXTENSION_IN" + extensions;
    }
}
