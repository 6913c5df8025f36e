package com.questrail.tracewire.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * ConnectionsParser
 * =============================================================================
 * Splits a connections string into protocol sections.
 *
 * <h2>Grammar</h2>
 * <pre>
 *   connections := section ( "," section )*
 *   section     := name "(" options ")"
 * </pre>
 * Option text is taken verbatim up to the matching {@code )}. Inside
 * double quotes parentheses and commas are ordinary characters and a
 * backslash escapes the next character ({@code \"} or {@code \\}).
 * Whitespace around the separating commas is ignored.
 *
 * <h2>Listeners</h2>
 * Registered {@link ConnectionFoundListener}s are notified, in registration
 * order, as each section completes. A section that was already reported stays
 * reported if a later section turns out to be malformed.
 *
 * <h2>Errors</h2>
 * A {@link ConnectionsParseException} names the 1-based position for a
 * protocol name without {@code (}, an unclosed quote, a missing {@code )} and
 * garbage between sections.
 */
public final class ConnectionsParser {

    private final List<ConnectionFoundListener> listeners = new CopyOnWriteArrayList<>();

    public void addListener(ConnectionFoundListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(ConnectionFoundListener listener) {
        listeners.remove(listener);
    }

    /**
     * Parses {@code connections} into its sections, in order of appearance.
     */
    public List<ConnectionDescriptor> parse(String connections) {
        Objects.requireNonNull(connections, "connections");

        List<ConnectionDescriptor> result = new ArrayList<>();
        String s = connections;
        int length = s.length();
        int i = skipWhitespace(s, 0);

        while (i < length) {
            // protocol name
            int nameStart = i;
            while (i < length && s.charAt(i) != '(') {
                char c = s.charAt(i);
                if (c == ')' || c == ',' || c == '"') {
                    break;
                }
                i++;
            }
            if (i >= length || s.charAt(i) != '(') {
                throw new ConnectionsParseException("Missing \"(\"", i + 1);
            }
            String name = s.substring(nameStart, i).trim();
            if (name.isEmpty()) {
                throw new ConnectionsParseException("Missing protocol name", i + 1);
            }
            i++;

            // option text up to the matching ')'
            int optionsStart = i;
            int depth = 0;
            boolean quoted = false;
            int quoteStart = -1;
            int optionsEnd = -1;
            while (i < length) {
                char c = s.charAt(i);
                if (quoted) {
                    if (c == '\\' && i + 1 < length) {
                        i += 2;
                        continue;
                    }
                    if (c == '"') {
                        quoted = false;
                    }
                } else if (c == '"') {
                    quoted = true;
                    quoteStart = i;
                } else if (c == '(') {
                    depth++;
                } else if (c == ')') {
                    if (depth == 0) {
                        optionsEnd = i;
                        break;
                    }
                    depth--;
                }
                i++;
            }
            if (quoted) {
                throw new ConnectionsParseException(
                    "Quoted option value not closed in \"" + name + "\" section", quoteStart + 1);
            }
            if (optionsEnd < 0) {
                throw new ConnectionsParseException(
                    "Missing \")\" in \"" + name + "\" section", length + 1);
            }

            ConnectionDescriptor descriptor =
                new ConnectionDescriptor(name, s.substring(optionsStart, optionsEnd));
            i = skipWhitespace(s, optionsEnd + 1);

            // separator
            if (i < length) {
                if (s.charAt(i) != ',') {
                    throw new ConnectionsParseException("Expected \",\" between sections", i + 1);
                }
                i = skipWhitespace(s, i + 1);
            }

            result.add(descriptor);
            fireConnectionFound(descriptor);
        }
        return result;
    }

    private void fireConnectionFound(ConnectionDescriptor descriptor) {
        for (ConnectionFoundListener listener : listeners) {
            listener.onConnectionFound(descriptor);
        }
    }

    private static int skipWhitespace(String s, int i) {
        while (i < s.length() && Character.isWhitespace(s.charAt(i))) {
            i++;
        }
        return i;
    }
}
