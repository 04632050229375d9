package com.postflow.config;

import java.util.List;
import java.util.Map;

/**
 * Root configuration.
 *
 * @param name      Engine name
 * @param version   Configuration version
 * @param engine    Engine tuning
 * @param seedRules Rule documents compiled at startup
 */
public record EngineConfig(
        String name,
        String version,
        EngineSettings engine,
        List<Map<String, Object>> seedRules
) {
    public EngineConfig {
        seedRules = seedRules == null ? List.of() : List.copyOf(seedRules);
    }

    /**
     * Create a minimal configuration for testing.
     */
    public static EngineConfig minimal() {
        return new EngineConfig("test-engine", "1.0", EngineSettings.defaults(), List.of());
    }
}
