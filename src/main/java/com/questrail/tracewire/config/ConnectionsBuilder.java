package com.questrail.tracewire.config;

import com.questrail.tracewire.packet.Level;

import java.util.Locale;
import java.util.Map;

/**
 * Assembles a connections string programmatically.
 *
 * <pre>
 *   String s = new ConnectionsBuilder()
 *       .beginProtocol("file")
 *       .addOption("filename", "c:\\log.sil")
 *       .addOption("append", true)
 *       .endProtocol()
 *       .toString();   // file(filename="c:\\log.sil", append="true")
 * </pre>
 *
 * Every value is quoted and escaped so that {@link ConnectionsParser} and
 * {@link OptionsParser} return it unchanged.
 */
public final class ConnectionsBuilder {

    private final StringBuilder connections = new StringBuilder();
    private boolean hasOptions;
    private boolean inProtocol;

    public ConnectionsBuilder beginProtocol(String protocol) {
        if (inProtocol) {
            throw new IllegalStateException("endProtocol() not called for previous section");
        }
        if (connections.length() > 0) {
            connections.append(", ");
        }
        connections.append(protocol).append('(');
        hasOptions = false;
        inProtocol = true;
        return this;
    }

    public ConnectionsBuilder endProtocol() {
        if (!inProtocol) {
            throw new IllegalStateException("beginProtocol() not called");
        }
        connections.append(')');
        inProtocol = false;
        return this;
    }

    public ConnectionsBuilder addOption(String key, String value) {
        if (!inProtocol) {
            throw new IllegalStateException("beginProtocol() not called");
        }
        if (hasOptions) {
            connections.append(", ");
        }
        connections.append(key).append("=\"").append(escape(value)).append('"');
        hasOptions = true;
        return this;
    }

    public ConnectionsBuilder addOption(String key, boolean value) {
        return addOption(key, Boolean.toString(value));
    }

    public ConnectionsBuilder addOption(String key, long value) {
        return addOption(key, Long.toString(value));
    }

    public ConnectionsBuilder addOption(String key, Level value) {
        return addOption(key, value.label());
    }

    public ConnectionsBuilder addOption(String key, Enum<?> value) {
        return addOption(key, value.name().toLowerCase(Locale.ROOT));
    }

    public ConnectionsBuilder addOptions(Map<String, String> options) {
        options.forEach(this::addOption);
        return this;
    }

    public void clear() {
        connections.setLength(0);
        hasOptions = false;
        inProtocol = false;
    }

    /**
     * Renders one complete section.
     */
    public static String describe(String protocol, Map<String, String> options) {
        return new ConnectionsBuilder().beginProtocol(protocol).addOptions(options).endProtocol().toString();
    }

    @Override
    public String toString() {
        return connections.toString();
    }

    static String escape(String value) {
        return value.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
