package com.postflow.adapter.livestate;

import com.postflow.guardrail.LiveState;
import com.postflow.guardrail.LiveStateProvider;

import java.io.File;
import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Live state from the local host: CPU load from the system load average and free space
 * of the configured volumes. Recording, streaming and GPU facts are left unknown, so
 * guardrails on them block until a provider that knows them is wired in.
 */
public class SystemLiveStateProvider implements LiveStateProvider {

    private static final double BYTES_PER_GB = 1024d * 1024d * 1024d;

    private final OperatingSystemMXBean osBean = ManagementFactory.getOperatingSystemMXBean();
    private final String mediaRoot;
    private final List<String> volumes;

    /**
     * @param mediaRoot Default media volume
     * @param volumes   Extra paths guardrails may name
     */
    public SystemLiveStateProvider(String mediaRoot, List<String> volumes) {
        this.mediaRoot = mediaRoot;
        this.volumes = List.copyOf(volumes);
    }

    @Override
    public LiveState snapshot() {
        Map<String, Double> freeByPath = new HashMap<>();
        for (String volume : volumes) {
            Double free = freeSpaceGb(volume);
            if (free != null) {
                freeByPath.put(volume, free);
            }
        }
        return LiveState.unknown()
                .withLoad(cpuPercent(), null)
                .withFreeSpace(freeSpaceGb(mediaRoot), freeByPath);
    }

    private Double cpuPercent() {
        double load = osBean.getSystemLoadAverage();
        if (load < 0) {
            return null;
        }
        return Math.min(100d, load / osBean.getAvailableProcessors() * 100d);
    }

    private static Double freeSpaceGb(String path) {
        File file = new File(path);
        if (!file.exists()) {
            return null;
        }
        return file.getUsableSpace() / BYTES_PER_GB;
    }
}
