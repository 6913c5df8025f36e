package com.questrail.tracewire.runtime;

import com.questrail.tracewire.config.ConfigurationException;
import com.questrail.tracewire.config.ConnectionDescriptor;
import com.questrail.tracewire.config.ConnectionVariables;
import com.questrail.tracewire.config.ConnectionsParser;
import com.questrail.tracewire.internal.time.MonotonicClock;
import com.questrail.tracewire.internal.time.SystemMonotonicClock;
import com.questrail.tracewire.internal.time.SystemWallClock;
import com.questrail.tracewire.internal.time.WallClock;
import com.questrail.tracewire.observability.CompositeObservabilitySink;
import com.questrail.tracewire.observability.ProtocolErrorEvent;
import com.questrail.tracewire.observability.ProtocolObservabilitySink;
import com.questrail.tracewire.packet.Packet;
import com.questrail.tracewire.protocol.Protocol;
import com.questrail.tracewire.protocol.ProtocolCommand;
import com.questrail.tracewire.protocol.ProtocolException;
import com.questrail.tracewire.transport.ProtocolFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * TraceRuntime
 * =============================================================================
 * Composition root and lifecycle owner for a set of protocols configured by
 * one connections string.
 *
 * <h2>Lifecycle</h2>
 * The host application builds one runtime at startup and passes it to the
 * code that produces packets. {@link #enable()} connects every protocol,
 * {@link #disable()} disconnects them, {@link #close()} disables the runtime
 * and releases the protocols.
 *
 * <h2>Failures</h2>
 * A {@link ProtocolException} raised by one protocol while sending,
 * connecting or dispatching is reported to the runtime sinks and never stops
 * the other protocols. Protocol events (state transitions, info, errors of
 * asynchronous protocols) reach the same sinks.
 */
public final class TraceRuntime implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TraceRuntime.class);

    private final String appName;
    private final String hostName;
    private final ConnectionVariables variables;
    private final CompositeObservabilitySink sinks = new CompositeObservabilitySink();
    private final ProtocolFactory protocolFactory;
    private final WallClock wallClock;

    private final Object lock = new Object();
    private List<Protocol> protocols = List.of();
    private volatile boolean enabled;

    private TraceRuntime(Builder b) {
        this.appName = b.appName;
        this.hostName = b.hostName != null ? b.hostName : localHostName();
        this.variables = b.variables;
        this.wallClock = b.wallClock;
        this.protocolFactory = new ProtocolFactory(b.monotonicClock, b.wallClock);
        b.sinks.forEach(sinks::add);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Replaces the protocols with those described by {@code connections}.
     * Variables are expanded first. The previous protocols are disconnected;
     * when the runtime is enabled the new ones are connected.
     *
     * @throws ConfigurationException for a malformed string, unknown protocol
     *         or invalid option; no protocols remain afterwards
     */
    public void setConnections(String connections) {
        synchronized (lock) {
            releaseProtocols();
            if (connections == null || connections.isBlank()) {
                return;
            }

            List<Protocol> created = new ArrayList<>();
            try {
                List<ConnectionDescriptor> descriptors = new ConnectionsParser().parse(variables.expand(connections));
                for (ConnectionDescriptor d : descriptors) {
                    Protocol protocol = protocolFactory.create(d.protocolName(), d.rawOptions());
                    protocol.setAppName(appName);
                    protocol.setHostName(hostName);
                    protocol.addSink(sinks);
                    created.add(protocol);
                }
            } catch (ConfigurationException e) {
                created.forEach(Protocol::close);
                throw e;
            }

            protocols = List.copyOf(created);
            log.debug("Loaded {} protocol(s)", protocols.size());
            if (enabled) {
                connectAll();
            }
        }
    }

    public void enable() {
        synchronized (lock) {
            if (enabled) {
                return;
            }
            enabled = true;
            connectAll();
        }
    }

    public void disable() {
        synchronized (lock) {
            if (!enabled) {
                return;
            }
            enabled = false;
            disconnectAll();
        }
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Writes {@code packet} to every protocol in connection order. Ignored
     * while disabled.
     */
    public void send(Packet packet) {
        Objects.requireNonNull(packet, "packet");
        if (!enabled) {
            return;
        }
        for (Protocol protocol : currentProtocols()) {
            try {
                protocol.writePacket(packet);
            } catch (ProtocolException e) {
                reportError(protocol, e);
            }
        }
    }

    /**
     * Routes a custom command to the protocol whose caption matches
     * {@code caption}, ignoring case. An unknown caption is reported as an
     * error.
     */
    public void dispatch(String caption, int action, Object state) {
        Objects.requireNonNull(caption, "caption");
        for (Protocol protocol : currentProtocols()) {
            if (protocol.caption().equalsIgnoreCase(caption)) {
                try {
                    protocol.dispatch(new ProtocolCommand(action, state));
                } catch (ProtocolException e) {
                    reportError(protocol, e);
                }
                return;
            }
        }
        sinks.onError(new ProtocolErrorEvent(wallClock.now(), "", caption,
            "No protocol could be found with the caption \"" + caption + "\"", null));
    }

    /** Protocols in connection order. */
    public List<Protocol> protocols() {
        return currentProtocols();
    }

    public ConnectionVariables variables() {
        return variables;
    }

    public String appName() {
        return appName;
    }

    public String hostName() {
        return hostName;
    }

    public void addSink(ProtocolObservabilitySink sink) {
        sinks.add(sink);
    }

    public void removeSink(ProtocolObservabilitySink sink) {
        sinks.remove(sink);
    }

    @Override
    public void close() {
        synchronized (lock) {
            disable();
            releaseProtocols();
        }
    }

    private List<Protocol> currentProtocols() {
        synchronized (lock) {
            return protocols;
        }
    }

    private void connectAll() {
        for (Protocol protocol : protocols) {
            try {
                protocol.connect();
            } catch (ProtocolException e) {
                reportError(protocol, e);
            }
        }
    }

    private void disconnectAll() {
        for (Protocol protocol : protocols) {
            try {
                protocol.disconnect();
            } catch (ProtocolException e) {
                reportError(protocol, e);
            }
        }
    }

    private void releaseProtocols() {
        for (Protocol protocol : protocols) {
            try {
                protocol.close();
            } catch (ProtocolException e) {
                reportError(protocol, e);
            }
        }
        protocols = List.of();
    }

    private void reportError(Protocol protocol, ProtocolException e) {
        sinks.onError(new ProtocolErrorEvent(wallClock.now(), protocol.name(), protocol.caption(), e.getMessage(), e));
    }

    private static String localHostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.debug("Local host name not available, using \"localhost\"", e);
            return "localhost";
        }
    }

    public static final class Builder {
        private String appName = "Auto";
        private String hostName;
        private String connections;
        private ConnectionVariables variables = new ConnectionVariables();
        private final List<ProtocolObservabilitySink> sinks = new ArrayList<>();
        private MonotonicClock monotonicClock = SystemMonotonicClock.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private boolean enabled;

        public Builder withAppName(String appName) {
            this.appName = Objects.requireNonNull(appName, "appName");
            return this;
        }

        public Builder withHostName(String hostName) {
            this.hostName = Objects.requireNonNull(hostName, "hostName");
            return this;
        }

        public Builder withConnections(String connections) {
            this.connections = connections;
            return this;
        }

        public Builder withVariables(ConnectionVariables variables) {
            this.variables = Objects.requireNonNull(variables, "variables");
            return this;
        }

        public Builder withVariable(String key, String value) {
            this.variables.put(key, value);
            return this;
        }

        public Builder withObservabilitySink(ProtocolObservabilitySink sink) {
            this.sinks.add(Objects.requireNonNull(sink, "sink"));
            return this;
        }

        public Builder withMonotonicClock(MonotonicClock clock) {
            this.monotonicClock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public Builder withWallClock(WallClock clock) {
            this.wallClock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        /** Connects the protocols as part of {@link #build()}. */
        public Builder withEnabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        /**
         * @throws ConfigurationException for invalid connections
         */
        public TraceRuntime build() {
            TraceRuntime runtime = new TraceRuntime(this);
            if (connections != null) {
                runtime.setConnections(connections);
            }
            if (enabled) {
                runtime.enable();
            }
            return runtime;
        }
    }
}
