package io.horde.api;

/**
 * Thrown when a behavior profile, target or run configuration is invalid.
 * Always raised before any virtual user starts.
 */
public class ConfigurationException extends IllegalArgumentException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
