package com.postflow.guardrail;

import java.util.Map;
import java.util.Optional;

/**
 * Snapshot of live external state used by guardrails.
 * <p>
 * Every fact is optional: a provider that cannot determine a fact (e.g. OBS unreachable)
 * leaves it null, and guardrails depending on it block with
 * {@link GuardrailDecision#PROBE_UNAVAILABLE}.
 *
 * @param recording          Whether any recording source is recording
 * @param streaming          Whether any recording source is streaming
 * @param cpuPercent         Host CPU load, 0-100
 * @param gpuPercent         GPU load, 0-100
 * @param freeSpaceGbByPath  Free space per volume path
 * @param defaultFreeSpaceGb Free space of the default media volume
 * @param queueDepth         Jobs waiting in the scheduling queue
 * @param runningJobs        Jobs currently executing
 */
public record LiveState(
        Boolean recording,
        Boolean streaming,
        Double cpuPercent,
        Double gpuPercent,
        Map<String, Double> freeSpaceGbByPath,
        Double defaultFreeSpaceGb,
        Integer queueDepth,
        Integer runningJobs
) {
    public LiveState {
        freeSpaceGbByPath = freeSpaceGbByPath == null ? Map.of() : Map.copyOf(freeSpaceGbByPath);
    }

    public static LiveState unknown() {
        return new LiveState(null, null, null, null, Map.of(), null, null, null);
    }

    public Optional<Double> freeSpaceGb(String path) {
        if (path == null) {
            return Optional.ofNullable(defaultFreeSpaceGb);
        }
        return Optional.ofNullable(freeSpaceGbByPath.get(path));
    }

    /**
     * Copy with queue facts supplied by the engine.
     */
    public LiveState withQueueStats(int queueDepth, int runningJobs) {
        return new LiveState(recording, streaming, cpuPercent, gpuPercent, freeSpaceGbByPath,
                defaultFreeSpaceGb, queueDepth, runningJobs);
    }

    public LiveState withRecording(Boolean recording) {
        return new LiveState(recording, streaming, cpuPercent, gpuPercent, freeSpaceGbByPath,
                defaultFreeSpaceGb, queueDepth, runningJobs);
    }

    public LiveState withStreaming(Boolean streaming) {
        return new LiveState(recording, streaming, cpuPercent, gpuPercent, freeSpaceGbByPath,
                defaultFreeSpaceGb, queueDepth, runningJobs);
    }

    public LiveState withLoad(Double cpuPercent, Double gpuPercent) {
        return new LiveState(recording, streaming, cpuPercent, gpuPercent, freeSpaceGbByPath,
                defaultFreeSpaceGb, queueDepth, runningJobs);
    }

    public LiveState withFreeSpace(Double defaultFreeSpaceGb, Map<String, Double> byPath) {
        return new LiveState(recording, streaming, cpuPercent, gpuPercent, byPath,
                defaultFreeSpaceGb, queueDepth, runningJobs);
    }
}
