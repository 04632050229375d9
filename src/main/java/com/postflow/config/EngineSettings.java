package com.postflow.config;

import java.time.Duration;
import java.time.ZoneId;

/**
 * Engine tuning.
 *
 * @param zoneId                   Zone active hours are expressed in
 * @param maxConcurrency           Jobs running at once
 * @param queueCapacity            Ready jobs the queue holds, 0 for unbounded
 * @param recheckIntervalSeconds   Period of the deferred-job recheck loop
 * @param defaultRetryDelaySeconds Recheck delay for guardrails without their own
 * @param maxRetryDelaySeconds     Ceiling for the growing delay of repeated rechecks
 * @param probeTimeoutMillis       Time allowed for one live-state probe
 * @param workerThreadPrefix       Prefix for worker thread names
 */
public record EngineSettings(
        ZoneId zoneId,
        int maxConcurrency,
        int queueCapacity,
        int recheckIntervalSeconds,
        int defaultRetryDelaySeconds,
        int maxRetryDelaySeconds,
        long probeTimeoutMillis,
        String workerThreadPrefix
) {
    public static EngineSettings defaults() {
        return new EngineSettings(
                ZoneId.of("UTC"),
                2,                    // maxConcurrency
                1000,                 // queueCapacity
                10,                   // recheckIntervalSeconds
                60,                   // defaultRetryDelaySeconds
                300,                  // maxRetryDelaySeconds
                2000,                 // probeTimeoutMillis
                "postflow-worker-"    // workerThreadPrefix
        );
    }

    public EngineSettings withMaxConcurrency(int maxConcurrency) {
        return new EngineSettings(zoneId, maxConcurrency, queueCapacity, recheckIntervalSeconds,
                defaultRetryDelaySeconds, maxRetryDelaySeconds, probeTimeoutMillis, workerThreadPrefix);
    }

    public EngineSettings withQueueCapacity(int queueCapacity) {
        return new EngineSettings(zoneId, maxConcurrency, queueCapacity, recheckIntervalSeconds,
                defaultRetryDelaySeconds, maxRetryDelaySeconds, probeTimeoutMillis, workerThreadPrefix);
    }

    public EngineSettings withZoneId(ZoneId zoneId) {
        return new EngineSettings(zoneId, maxConcurrency, queueCapacity, recheckIntervalSeconds,
                defaultRetryDelaySeconds, maxRetryDelaySeconds, probeTimeoutMillis, workerThreadPrefix);
    }

    public EngineSettings withProbeTimeoutMillis(long probeTimeoutMillis) {
        return new EngineSettings(zoneId, maxConcurrency, queueCapacity, recheckIntervalSeconds,
                defaultRetryDelaySeconds, maxRetryDelaySeconds, probeTimeoutMillis, workerThreadPrefix);
    }

    public EngineSettings withMaxRetryDelaySeconds(int maxRetryDelaySeconds) {
        return new EngineSettings(zoneId, maxConcurrency, queueCapacity, recheckIntervalSeconds,
                defaultRetryDelaySeconds, maxRetryDelaySeconds, probeTimeoutMillis, workerThreadPrefix);
    }

    public Duration recheckInterval() {
        return Duration.ofSeconds(recheckIntervalSeconds);
    }

    public Duration defaultRetryDelay() {
        return Duration.ofSeconds(defaultRetryDelaySeconds);
    }

    public Duration maxRetryDelay() {
        return Duration.ofSeconds(maxRetryDelaySeconds);
    }

    public Duration probeTimeout() {
        return Duration.ofMillis(probeTimeoutMillis);
    }
}
