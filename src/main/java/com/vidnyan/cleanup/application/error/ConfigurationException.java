package com.vidnyan.cleanup.application.error;

/**
 * Invalid or missing configuration. Fatal at startup, never retried.
 */
public class ConfigurationException extends CleanupException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
