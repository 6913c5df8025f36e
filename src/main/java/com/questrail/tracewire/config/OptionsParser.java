package com.questrail.tracewire.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * OptionsParser
 * -----------------------------------------------------------------------------
 * Splits the option text of one protocol section into key/value pairs.
 *
 * <p>Quoting follows {@link ConnectionsParser}: inside double quotes commas
 * are literal and {@code \"} / {@code \\} unescape to {@code "} / {@code \}.
 * Whitespace around keys, {@code =} and {@code ,} is trimmed; whitespace
 * inside quotes is kept.</p>
 *
 * <p>Listeners are notified once per pair, left to right.</p>
 */
public final class OptionsParser {

    private final List<OptionFoundListener> listeners = new CopyOnWriteArrayList<>();

    public void addListener(OptionFoundListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(OptionFoundListener listener) {
        listeners.remove(listener);
    }

    public List<ProtocolOption> parse(String protocol, String options) {
        Objects.requireNonNull(protocol, "protocol");
        Objects.requireNonNull(options, "options");

        List<ProtocolOption> result = new ArrayList<>();
        String s = options;
        int length = s.length();
        int i = skipWhitespace(s, 0);

        while (i < length) {
            int keyStart = i;
            while (i < length && s.charAt(i) != '=' && s.charAt(i) != ',') {
                i++;
            }
            if (i >= length || s.charAt(i) != '=') {
                throw new ConnectionsParseException(
                    "Missing \"=\" in \"" + protocol + "\" options", i + 1);
            }
            String key = s.substring(keyStart, i).trim();
            if (key.isEmpty()) {
                throw new ConnectionsParseException(
                    "Missing option name in \"" + protocol + "\" options", i + 1);
            }
            i = skipWhitespace(s, i + 1);

            StringBuilder value = new StringBuilder();
            int keep = 0; // trailing trim never cuts into quoted text
            boolean quoted = false;
            int quoteStart = -1;
            while (i < length) {
                char c = s.charAt(i++);
                if (quoted) {
                    if (c == '\\' && i < length) {
                        value.append(s.charAt(i++));
                    } else if (c == '"') {
                        quoted = false;
                        keep = value.length();
                    } else {
                        value.append(c);
                    }
                } else if (c == '"') {
                    quoted = true;
                    quoteStart = i - 1;
                } else if (c == ',') {
                    break;
                } else {
                    value.append(c);
                }
            }
            if (quoted) {
                throw new ConnectionsParseException(
                    "Quoted value not closed in \"" + protocol + "\" options", quoteStart + 1);
            }

            int end = value.length();
            while (end > keep && Character.isWhitespace(value.charAt(end - 1))) {
                end--;
            }
            value.setLength(end);

            ProtocolOption option = new ProtocolOption(protocol, key, value.toString());
            result.add(option);
            for (OptionFoundListener listener : listeners) {
                listener.onOptionFound(option);
            }
            i = skipWhitespace(s, i);
        }
        return result;
    }

    private static int skipWhitespace(String s, int i) {
        while (i < s.length() && Character.isWhitespace(s.charAt(i))) {
            i++;
        }
        return i;
    }
}
