package com.questrail.tracewire.config;

/**
 * Invalid configuration: malformed connections string, unknown protocol,
 * option not supported by a protocol, or an option value a protocol cannot
 * work with (such as an encryption key of the wrong size).
 */
public class ConfigurationException extends RuntimeException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
