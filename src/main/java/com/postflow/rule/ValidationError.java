package com.postflow.rule;

/**
 * A single problem found while compiling a rule document.
 *
 * @param path    Field path inside the document (e.g. "conditions[1].params.value")
 * @param message Human-readable description of the problem
 */
public record ValidationError(String path, String message) {

    @Override
    public String toString() {
        return path + ": " + message;
    }
}
