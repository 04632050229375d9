package com.postflow.compiler;

import com.postflow.exception.RuleCompilationException;
import com.postflow.rule.Rule;
import com.postflow.rule.ValidationError;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of compiling a rule document: either a complete rule or every validation error found.
 */
public final class CompilationResult {

    private final Rule rule;
    private final List<ValidationError> errors;

    private CompilationResult(Rule rule, List<ValidationError> errors) {
        this.rule = rule;
        this.errors = List.copyOf(errors);
    }

    static CompilationResult success(Rule rule) {
        return new CompilationResult(rule, List.of());
    }

    static CompilationResult failure(List<ValidationError> errors) {
        if (errors.isEmpty()) {
            throw new IllegalArgumentException("A failed compilation needs at least one error");
        }
        return new CompilationResult(null, errors);
    }

    public boolean isSuccess() {
        return rule != null;
    }

    public Optional<Rule> getRule() {
        return Optional.ofNullable(rule);
    }

    public List<ValidationError> getErrors() {
        return errors;
    }

    /**
     * Return the compiled rule.
     *
     * @throws RuleCompilationException carrying all errors if compilation failed
     */
    public Rule orElseThrow() {
        if (rule == null) {
            throw new RuleCompilationException(errors);
        }
        return rule;
    }
}
