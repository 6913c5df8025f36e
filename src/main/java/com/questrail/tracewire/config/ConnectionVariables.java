package com.questrail.tracewire.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Named values substituted into connections strings. A variable
 * {@code logdir} is referenced as {@code $logdir$} (case-insensitive);
 * unknown references are left untouched.
 *
 * <p>Thread safe.</p>
 */
public final class ConnectionVariables {

    private final Map<String, String> variables = new LinkedHashMap<>();

    public synchronized void put(String key, String value) {
        variables.put(key(key), Objects.requireNonNull(value, "value"));
    }

    public synchronized void remove(String key) {
        variables.remove(key(key));
    }

    public synchronized String get(String key) {
        return variables.get(key(key));
    }

    public synchronized boolean contains(String key) {
        return variables.containsKey(key(key));
    }

    public synchronized int count() {
        return variables.size();
    }

    public synchronized void clear() {
        variables.clear();
    }

    public synchronized String expand(String connections) {
        Objects.requireNonNull(connections, "connections");
        if (connections.indexOf('$') < 0 || variables.isEmpty()) {
            return connections;
        }
        String result = connections;
        for (Map.Entry<String, String> e : variables.entrySet()) {
            Pattern p = Pattern.compile(Pattern.quote("$" + e.getKey() + "$"), Pattern.CASE_INSENSITIVE);
            result = p.matcher(result).replaceAll(Matcher.quoteReplacement(e.getValue()));
        }
        return result;
    }

    private static String key(String key) {
        return Objects.requireNonNull(key, "key").trim().toLowerCase(Locale.ROOT);
    }
}
