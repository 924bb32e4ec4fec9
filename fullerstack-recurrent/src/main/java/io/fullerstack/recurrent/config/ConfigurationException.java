package io.fullerstack.recurrent.config;

/**
 * Thrown when a required configuration key is missing or cannot be parsed.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
