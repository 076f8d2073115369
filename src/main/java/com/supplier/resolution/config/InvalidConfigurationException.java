package com.supplier.resolution.config;

/**
 * Runtime exception thrown when weights, thresholds or other run settings are invalid.
 * Always raised before any input row is processed.
 */
public class InvalidConfigurationException extends RuntimeException {

    public InvalidConfigurationException(String message) {
        super(message);
    }

    public InvalidConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
