package com.postflow.queue;

/**
 * Result reported by a job executor.
 *
 * @param success Whether every action completed
 * @param error   Failure message when not successful
 */
public record ExecutionOutcome(boolean success, String error) {

    public static ExecutionOutcome completed() {
        return new ExecutionOutcome(true, null);
    }

    public static ExecutionOutcome failure(String error) {
        return new ExecutionOutcome(false, error);
    }
}
