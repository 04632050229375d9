package com.postflow.dispatch;

import java.time.Duration;

/**
 * Runs a task on the engine thread after a delay.
 */
@FunctionalInterface
public interface FireScheduler {

    void schedule(Runnable task, Duration delay);
}
