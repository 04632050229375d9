package com.postflow.core;

/**
 * Engine statistics.
 */
public record EngineStats(
        int queued,
        int running,
        long deferred,
        long completed,
        long failed,
        long canceled,
        int pendingFires,
        boolean paused,
        int maxConcurrency,
        long eventsReceived
) {}
