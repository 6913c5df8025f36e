package com.questrail.tracewire.codec.text;

import com.questrail.tracewire.packet.LogEntry;
import com.questrail.tracewire.packet.Packets;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Objects;

/**
 * One element of a parsed text pattern: either literal text or a
 * {@code %variable%} bound to a log entry field.
 *
 * <p>Variables may carry options in braces and a width after a comma:
 * {@code %timestamp{HH:mm:ss}%}, {@code %title,-30%}. A positive width
 * right-aligns the value, a negative width left-aligns it.</p>
 */
final class PatternToken {

    static final String DEFAULT_TIMESTAMP_PATTERN = "yyyy-MM-dd HH:mm:ss.SSSSSS";

    enum Variable {
        APP_NAME("appname"),
        SESSION("session"),
        HOST_NAME("hostname"),
        TITLE("title"),
        TIMESTAMP("timestamp"),
        LEVEL("level"),
        COLOR("color"),
        LOG_ENTRY_TYPE("logentrytype"),
        VIEWER_ID("viewerid"),
        THREAD("thread"),
        PROCESS("process");

        private final String tokenName;

        Variable(String tokenName) {
            this.tokenName = tokenName;
        }

        static Variable byName(String name) {
            for (Variable v : values()) {
                if (v.tokenName.equals(name)) {
                    return v;
                }
            }
            return null;
        }
    }

    private final Variable variable;
    private final String literal;
    private final int width;
    private final DateTimeFormatter timestampFormat;

    private PatternToken(Variable variable, String literal, int width, DateTimeFormatter timestampFormat) {
        this.variable = variable;
        this.literal = literal;
        this.width = width;
        this.timestampFormat = timestampFormat;
    }

    static PatternToken literal(String text) {
        return new PatternToken(null, text, 0, null);
    }

    /**
     * Builds a token from raw pattern text such as {@code %title,20%} or
     * {@code - }. Unknown variables become literals.
     */
    static PatternToken of(String raw, ZoneId zone) {
        Objects.requireNonNull(raw, "raw");
        int length = raw.length();
        if (length <= 2 || raw.charAt(0) != '%' || raw.charAt(length - 1) != '%') {
            return literal(raw);
        }

        String body = raw.substring(1, length - 1);
        String options = "";
        if (body.endsWith("}")) {
            int open = body.indexOf('{');
            if (open > -1) {
                options = body.substring(open + 1, body.length() - 1);
                body = body.substring(0, open);
            }
        }

        int width = 0;
        int comma = body.indexOf(',');
        if (comma != -1) {
            width = parseWidth(body.substring(comma + 1));
            body = body.substring(0, comma);
        }

        Variable variable = Variable.byName(body.trim().toLowerCase(Locale.ROOT));
        if (variable == null) {
            return literal(raw);
        }

        DateTimeFormatter format = null;
        if (variable == Variable.TIMESTAMP) {
            format = timestampFormat(options, zone);
        }
        return new PatternToken(variable, null, width, format);
    }

    /** Whether the token is prefixed by the current indentation. */
    boolean indent() {
        return variable == Variable.TITLE;
    }

    int width() {
        return width;
    }

    String expand(LogEntry entry) {
        if (variable == null) {
            return literal;
        }
        return switch (variable) {
            case APP_NAME -> entry.appName();
            case SESSION -> entry.sessionName();
            case HOST_NAME -> entry.hostName();
            case TITLE -> entry.title();
            case TIMESTAMP -> timestampFormat.format(entry.timestamp());
            case LEVEL -> displayName(entry.level().name());
            case COLOR -> entry.color() == Packets.DEFAULT_COLOR
                ? "<default>"
                : String.format("0x%08X", entry.color());
            case LOG_ENTRY_TYPE -> displayName(entry.logEntryType().name());
            case VIEWER_ID -> displayName(entry.viewerId().name());
            case THREAD -> Integer.toString(entry.threadId());
            case PROCESS -> Integer.toString(entry.processId());
        };
    }

    private static int parseWidth(String s) {
        try {
            return Integer.parseInt(s.trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    private static DateTimeFormatter timestampFormat(String options, ZoneId zone) {
        DateTimeFormatter fallback = DateTimeFormatter.ofPattern(DEFAULT_TIMESTAMP_PATTERN).withZone(zone);
        if (options.isEmpty()) {
            return fallback;
        }
        try {
            return DateTimeFormatter.ofPattern(options).withZone(zone);
        } catch (IllegalArgumentException e) {
            return fallback;
        }
    }

    /** ENTER_METHOD becomes EnterMethod. */
    static String displayName(String constant) {
        StringBuilder sb = new StringBuilder(constant.length());
        boolean upper = true;
        for (char c : constant.toCharArray()) {
            if (c == '_') {
                upper = true;
            } else {
                sb.append(upper ? c : Character.toLowerCase(c));
                upper = false;
            }
        }
        return sb.toString();
    }
}
