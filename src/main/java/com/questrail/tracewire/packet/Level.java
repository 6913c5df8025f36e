package com.questrail.tracewire.packet;

import java.util.Locale;

/**
 * Level
 * =============================================================================
 * Severity attached to every packet.
 *
 * <p>Levels are ordered: a protocol configured with {@code level=warning}
 * ignores {@link #DEBUG}, {@link #VERBOSE} and {@link #MESSAGE} packets.
 * {@link #CONTROL} is reserved for control commands and is never filtered
 * by the backlog flush rule.</p>
 *
 * <p>The level is a routing attribute only; it is not written to the wire.</p>
 */
public enum Level {
    DEBUG,
    VERBOSE,
    MESSAGE,
    WARNING,
    ERROR,
    FATAL,
    CONTROL;

    /** Lower-case name as used in option strings and text patterns. */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isAtLeast(Level other) {
        return compareTo(other) >= 0;
    }

    /**
     * Parses an option value ({@code debug}, {@code verbose}, ...).
     * Returns {@code defaultValue} for null or unknown input.
     */
    public static Level parse(String value, Level defaultValue) {
        if (value == null) {
            return defaultValue;
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        for (Level level : values()) {
            if (level.label().equals(v)) {
                return level;
            }
        }
        return defaultValue;
    }
}
