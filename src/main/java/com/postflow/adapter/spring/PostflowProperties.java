package com.postflow.adapter.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Spring Boot configuration properties for Postflow.
 */
@ConfigurationProperties(prefix = "postflow")
public class PostflowProperties {

    /**
     * Whether Postflow is enabled.
     */
    private boolean enabled = true;

    /**
     * Path to the Postflow configuration file.
     * Supports classpath: prefix for classpath resources.
     */
    private String configPath = "classpath:postflow.yaml";

    /**
     * Default media volume for free-space guardrails.
     */
    private String mediaRoot = ".";

    /**
     * Extra volumes free-space guardrails may name.
     */
    private List<String> volumes = new ArrayList<>();

    /**
     * Whether engine notifications are republished as Spring application events.
     */
    private boolean publishEvents = true;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getConfigPath() {
        return configPath;
    }

    public void setConfigPath(String configPath) {
        this.configPath = configPath;
    }

    public String getMediaRoot() {
        return mediaRoot;
    }

    public void setMediaRoot(String mediaRoot) {
        this.mediaRoot = mediaRoot;
    }

    public List<String> getVolumes() {
        return volumes;
    }

    public void setVolumes(List<String> volumes) {
        this.volumes = volumes;
    }

    public boolean isPublishEvents() {
        return publishEvents;
    }

    public void setPublishEvents(boolean publishEvents) {
        this.publishEvents = publishEvents;
    }
}
