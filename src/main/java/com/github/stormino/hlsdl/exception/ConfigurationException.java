package com.github.stormino.hlsdl.exception;

/**
 * Exception thrown when a download request or configuration value is invalid.
 */
public class ConfigurationException extends DownloadException {

    private final String configKey;
    private final String configValue;

    public ConfigurationException(String message) {
        super(message);
        this.configKey = null;
        this.configValue = null;
    }

    public ConfigurationException(String message, String configKey) {
        super(message);
        this.configKey = configKey;
        this.configValue = null;
    }

    public ConfigurationException(String message, String configKey, String configValue) {
        super(message);
        this.configKey = configKey;
        this.configValue = configValue;
    }

    public String getConfigKey() {
        return configKey;
    }

    public String getConfigValue() {
        return configValue;
    }
}
