package com.questrail.tracewire.transport.file;

import java.util.Locale;

/**
 * Time-based rotation granularity of a log file.
 */
public enum FileRotate {
    NO_ROTATE("none"),
    HOURLY("hourly"),
    DAILY("daily"),
    WEEKLY("weekly"),
    MONTHLY("monthly");

    private final String label;

    FileRotate(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Parses an option value; unknown values yield {@code defaultValue}.
     */
    public static FileRotate parse(String value, FileRotate defaultValue) {
        if (value == null) {
            return defaultValue;
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        for (FileRotate r : values()) {
            if (r.label.equals(v)) {
                return r;
            }
        }
        return defaultValue;
    }
}
