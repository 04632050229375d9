package com.postflow.exception;

/**
 * Thrown when engine-owned state is found inconsistent.
 * Indicates a programming error; never caught and repaired silently.
 */
public class InvariantViolationException extends PostflowException {

    public InvariantViolationException(String message) {
        super(message);
    }
}
