package com.postflow.exception;

/**
 * Base exception for the Postflow engine.
 */
public class PostflowException extends RuntimeException {

    public PostflowException(String message) {
        super(message);
    }

    public PostflowException(String message, Throwable cause) {
        super(message, cause);
    }
}
