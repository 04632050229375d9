package com.postflow.config;

import com.postflow.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Loads engine configuration from YAML files.
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    /**
     * Load configuration from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the configuration file
     * @return Loaded configuration
     */
    public static EngineConfig load(String path) {
        log.info("Loading Postflow configuration from: {}", path);

        Resource resource = getResource(path);
        if (!resource.exists()) {
            throw new ConfigurationException("Configuration file not found: " + path);
        }
        try (InputStream inputStream = resource.getInputStream()) {
            return parseYaml(inputStream);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    /**
     * Parse configuration from YAML text.
     */
    public static EngineConfig loadFromString(String yamlText) {
        return parseYaml(new ByteArrayInputStream(yamlText.getBytes(StandardCharsets.UTF_8)));
    }

    private static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            String resourcePath = path.substring("classpath:".length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }

    @SuppressWarnings("unchecked")
    private static EngineConfig parseYaml(InputStream inputStream) {
        Yaml yaml = new Yaml();
        Object loaded = yaml.load(inputStream);

        if (loaded == null) {
            throw new ConfigurationException("Configuration file is empty");
        }
        if (!(loaded instanceof Map<?, ?>)) {
            throw new ConfigurationException("Configuration root must be a mapping");
        }
        Map<String, Object> root = (Map<String, Object>) loaded;

        // The postflow section may be at the root or under a 'postflow' key
        Map<String, Object> postflow = root.containsKey("postflow")
                ? section(root, "postflow")
                : root;

        String name = getString(postflow, "name", "postflow");
        String version = getString(postflow, "version", "1.0");
        EngineSettings engine = parseEngineSettings(section(postflow, "engine"));
        List<Map<String, Object>> rules = parseSeedRules(postflow.get("rules"));

        EngineConfig config = new EngineConfig(name, version, engine, rules);

        log.info("Loaded Postflow configuration: {} v{} (zone={}, maxConcurrency={}, queueCapacity={}, "
                        + "recheck={}s, seedRules={})",
                name, version, engine.zoneId(), engine.maxConcurrency(), engine.queueCapacity(),
                engine.recheckIntervalSeconds(), rules.size());

        return config;
    }

    private static EngineSettings parseEngineSettings(Map<String, Object> map) {
        EngineSettings defaults = EngineSettings.defaults();
        if (map == null) {
            return defaults;
        }

        ZoneId zoneId = parseZone(getString(map, "zone-id", defaults.zoneId().getId()));
        int maxConcurrency = getInt(map, "max-concurrency", defaults.maxConcurrency());
        int queueCapacity = getInt(map, "queue-capacity", defaults.queueCapacity());
        int recheckInterval = getInt(map, "recheck-interval-seconds", defaults.recheckIntervalSeconds());
        int retryDelay = getInt(map, "default-retry-delay-seconds", defaults.defaultRetryDelaySeconds());
        int maxRetryDelay = getInt(map, "max-retry-delay-seconds",
                Math.max(retryDelay, defaults.maxRetryDelaySeconds()));
        long probeTimeout = getLong(map, "probe-timeout-millis", defaults.probeTimeoutMillis());
        String workerPrefix = getString(map, "worker-thread-prefix", defaults.workerThreadPrefix());

        requireAtLeast("engine.max-concurrency", maxConcurrency, 1);
        requireAtLeast("engine.queue-capacity", queueCapacity, 0);
        requireAtLeast("engine.recheck-interval-seconds", recheckInterval, 1);
        requireAtLeast("engine.default-retry-delay-seconds", retryDelay, 1);
        requireAtLeast("engine.max-retry-delay-seconds", maxRetryDelay, retryDelay);
        requireAtLeast("engine.probe-timeout-millis", probeTimeout, 1);

        return new EngineSettings(zoneId, maxConcurrency, queueCapacity, recheckInterval, retryDelay,
                maxRetryDelay, probeTimeout, workerPrefix);
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> parseSeedRules(Object value) {
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> list)) {
            throw new ConfigurationException("postflow.rules must be a list of rule documents");
        }
        List<Map<String, Object>> documents = new ArrayList<>();
        for (int i = 0; i < list.size(); i++) {
            if (!(list.get(i) instanceof Map<?, ?> document)) {
                throw new ConfigurationException("postflow.rules[" + i + "] must be a mapping");
            }
            documents.add((Map<String, Object>) document);
        }
        return documents;
    }

    private static ZoneId parseZone(String zone) {
        try {
            return ZoneId.of(zone);
        } catch (DateTimeException e) {
            throw new ConfigurationException("Invalid engine.zone-id: " + zone, e);
        }
    }

    private static void requireAtLeast(String key, long value, long min) {
        if (value < min) {
            throw ConfigurationException.invalidSetting(key, "must be >= " + min + " but was " + value);
        }
    }

    // Helper methods

    @SuppressWarnings("unchecked")
    private static Map<String, Object> section(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) return null;
        if (!(value instanceof Map<?, ?>)) {
            throw ConfigurationException.invalidSetting(key, "must be a mapping");
        }
        return (Map<String, Object>) value;
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).intValue();
        try {
            return Integer.parseInt(value.toString());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("'" + key + "' must be an integer but was " + value, e);
        }
    }

    private static long getLong(Map<String, Object> map, String key, long defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).longValue();
        try {
            return Long.parseLong(value.toString());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("'" + key + "' must be an integer but was " + value, e);
        }
    }
}
