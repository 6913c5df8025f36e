package com.questrail.tracewire.config;

/**
 * Malformed connections or options string.
 */
public class ConnectionsParseException extends ConfigurationException {
    private final int position;

    public ConnectionsParseException(String message, int position) {
        super(message + " at position " + position);
        this.position = position;
    }

    /**
     * 1-based position of the offending character (one past the end when the
     * input ended early).
     */
    public int position() {
        return position;
    }
}
