package com.postflow.exception;

import com.postflow.rule.ValidationError;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Exception thrown when a rule document does not compile.
 * Carries every validation error found, not only the first one.
 */
public class RuleCompilationException extends PostflowException {

    private final List<ValidationError> errors;

    public RuleCompilationException(List<ValidationError> errors) {
        super("Rule compilation failed: " + errors.stream()
                .map(ValidationError::toString)
                .collect(Collectors.joining("; ")));
        this.errors = List.copyOf(errors);
    }

    public List<ValidationError> getErrors() {
        return errors;
    }
}
