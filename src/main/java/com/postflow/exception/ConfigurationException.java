package com.postflow.exception;

/**
 * Invalid or unreadable engine configuration. Raised while loading, so startup fails fast.
 * When the problem is tied to one setting, {@link #getSetting()} names it.
 */
public class ConfigurationException extends PostflowException {

    private final String setting;

    public ConfigurationException(String message) {
        this(message, (String) null);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
        this.setting = null;
    }

    private ConfigurationException(String message, String setting) {
        super(message);
        this.setting = setting;
    }

    public static ConfigurationException invalidSetting(String setting, String problem) {
        return new ConfigurationException("'" + setting + "' " + problem, setting);
    }

    public String getSetting() {
        return setting;
    }
}
