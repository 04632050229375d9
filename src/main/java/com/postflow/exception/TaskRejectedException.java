package com.postflow.exception;

/**
 * Exception thrown when a job cannot be accepted by the scheduling queue.
 * Typically due to the queue being full or the engine being shut down.
 */
public class TaskRejectedException extends PostflowException {

    public TaskRejectedException(String message) {
        super(message);
    }

    public TaskRejectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
