package com.postflow.variable;

import com.postflow.core.Event;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Default implementation of VariableResolver.
 */
public class DefaultVariableResolver implements VariableResolver {

    private static final Logger log = LoggerFactory.getLogger(DefaultVariableResolver.class);

    @Override
    public Optional<Object> resolve(String reference, Event event) {
        if (reference == null || reference.isEmpty() || event == null) {
            return Optional.empty();
        }

        try {
            VariableSource source = VariableSource.fromReference(reference);
            String name = VariableSource.extractName(reference);

            return switch (source) {
                case PAYLOAD -> event.payloadValue(name);
                case EVENT -> resolveEventVariable(name, event);
            };
        } catch (IllegalArgumentException e) {
            log.warn("Invalid variable reference: {}", reference);
            return Optional.empty();
        }
    }

    @Override
    public Optional<Double> resolveAsDouble(String reference, Event event) {
        return resolve(reference, event)
                .flatMap(this::convertToDouble);
    }

    private Optional<Object> resolveEventVariable(String name, Event event) {
        return switch (name) {
            case "subject_id" -> Optional.of(event.subjectId());
            case "trigger" -> Optional.of(event.trigger().wireName());
            case "timestamp" -> Optional.of(event.timestamp().toString());
            default -> Optional.empty();
        };
    }

    private Optional<Double> convertToDouble(Object value) {
        if (value instanceof Number n) {
            return Optional.of(n.doubleValue());
        }
        if (value instanceof String s) {
            try {
                return Optional.of(Double.parseDouble(s));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }
}
