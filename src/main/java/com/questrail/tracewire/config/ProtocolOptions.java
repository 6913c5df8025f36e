package com.questrail.tracewire.config;

import com.questrail.tracewire.packet.Level;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * ProtocolOptions
 * =============================================================================
 * Typed view of the options of one protocol section.
 *
 * <p>Keys are case-insensitive; a key given twice keeps its last value.
 * Getters never fail: a missing or unparsable value yields the supplied
 * default.</p>
 *
 * <h2>Value syntax</h2>
 * <ul>
 *   <li>boolean: {@code true}, {@code yes} or {@code 1}; anything else is false</li>
 *   <li>integer: decimal digits</li>
 *   <li>size: digits with optional {@code kb}, {@code mb} or {@code gb}
 *       suffix; no suffix means kilobytes</li>
 *   <li>timespan: digits with optional {@code s}, {@code m}, {@code h} or
 *       {@code d} suffix; no suffix means seconds</li>
 * </ul>
 */
public final class ProtocolOptions {

    private static final ProtocolOptions EMPTY = new ProtocolOptions(Map.of());

    private final Map<String, String> values;

    private ProtocolOptions(Map<String, String> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static ProtocolOptions empty() {
        return EMPTY;
    }

    public static ProtocolOptions of(List<ProtocolOption> options) {
        Map<String, String> map = new LinkedHashMap<>();
        for (ProtocolOption option : options) {
            map.put(normalize(option.key()), option.value());
        }
        return new ProtocolOptions(map);
    }

    /**
     * Parses the raw option text of a section.
     */
    public static ProtocolOptions parse(String protocol, String rawOptions) {
        return of(new OptionsParser().parse(protocol, rawOptions));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Set<String> keys() {
        return values.keySet();
    }

    public boolean contains(String key) {
        return values.containsKey(normalize(key));
    }

    public String getString(String key, String defaultValue) {
        String value = values.get(normalize(key));
        return value != null ? value : defaultValue;
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String value = values.get(normalize(key));
        if (value == null) {
            return defaultValue;
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        return v.equals("true") || v.equals("yes") || v.equals("1");
    }

    public int getInteger(String key, int defaultValue) {
        String value = values.get(normalize(key));
        if (value == null || !isDigits(value.trim())) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    /**
     * @param defaultKb default in kilobytes
     * @return size in bytes
     */
    public long getSizeBytes(String key, long defaultKb) {
        long defaultBytes = defaultKb * 1024L;
        String value = values.get(normalize(key));
        if (value == null) {
            return defaultBytes;
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        long factor = 1024L;
        if (v.endsWith("kb")) {
            v = v.substring(0, v.length() - 2);
        } else if (v.endsWith("mb")) {
            factor = 1024L * 1024L;
            v = v.substring(0, v.length() - 2);
        } else if (v.endsWith("gb")) {
            factor = 1024L * 1024L * 1024L;
            v = v.substring(0, v.length() - 2);
        }
        v = v.trim();
        if (!isDigits(v)) {
            return defaultBytes;
        }
        try {
            return Math.multiplyExact(Long.parseLong(v), factor);
        } catch (ArithmeticException | NumberFormatException e) {
            return defaultBytes;
        }
    }

    /**
     * @param defaultMillis default in milliseconds
     * @return timespan in milliseconds
     */
    public long getTimespanMillis(String key, long defaultMillis) {
        String value = values.get(normalize(key));
        if (value == null) {
            return defaultMillis;
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        long factor = 1000L;
        if (!v.isEmpty()) {
            switch (v.charAt(v.length() - 1)) {
                case 's' -> v = v.substring(0, v.length() - 1);
                case 'm' -> {
                    factor = 60_000L;
                    v = v.substring(0, v.length() - 1);
                }
                case 'h' -> {
                    factor = 3_600_000L;
                    v = v.substring(0, v.length() - 1);
                }
                case 'd' -> {
                    factor = 86_400_000L;
                    v = v.substring(0, v.length() - 1);
                }
                default -> {
                }
            }
        }
        v = v.trim();
        if (!isDigits(v)) {
            return defaultMillis;
        }
        try {
            return Math.multiplyExact(Long.parseLong(v), factor);
        } catch (ArithmeticException | NumberFormatException e) {
            return defaultMillis;
        }
    }

    public Level getLevel(String key, Level defaultValue) {
        return Level.parse(values.get(normalize(key)), defaultValue);
    }

    /**
     * UTF-8 bytes of the trimmed value, or {@code null} if the key is absent.
     */
    public byte[] getBytes(String key) {
        String value = values.get(normalize(key));
        return value == null ? null : value.trim().getBytes(StandardCharsets.UTF_8);
    }

    public Map<String, String> asMap() {
        return values;
    }

    @Override
    public String toString() {
        return values.toString();
    }

    static String normalize(String key) {
        return Objects.requireNonNull(key, "key").trim().toLowerCase(Locale.ROOT);
    }

    private static boolean isDigits(String s) {
        if (s.isEmpty()) {
            return false;
        }
        for (int i = 0; i < s.length(); i++) {
            if (!Character.isDigit(s.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    public static final class Builder {
        private final Map<String, String> values = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder with(String key, String value) {
            values.put(normalize(key), Objects.requireNonNull(value, "value"));
            return this;
        }

        public Builder with(String key, boolean value) {
            return with(key, Boolean.toString(value));
        }

        public Builder with(String key, long value) {
            return with(key, Long.toString(value));
        }

        public ProtocolOptions build() {
            return new ProtocolOptions(new LinkedHashMap<>(values));
        }
    }
}
