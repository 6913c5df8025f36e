package com.questrail.tracewire.protocol;

import com.questrail.tracewire.config.ConfigurationException;
import com.questrail.tracewire.config.ConnectionsBuilder;
import com.questrail.tracewire.config.OptionsParser;
import com.questrail.tracewire.config.ProtocolOptions;
import com.questrail.tracewire.internal.time.MonotonicClock;
import com.questrail.tracewire.internal.time.SystemMonotonicClock;
import com.questrail.tracewire.internal.time.SystemWallClock;
import com.questrail.tracewire.internal.time.WallClock;
import com.questrail.tracewire.observability.CompositeObservabilitySink;
import com.questrail.tracewire.observability.ProtocolErrorEvent;
import com.questrail.tracewire.observability.ProtocolInfoEvent;
import com.questrail.tracewire.observability.ProtocolObservabilitySink;
import com.questrail.tracewire.observability.ProtocolStateTransitionEvent;
import com.questrail.tracewire.packet.Level;
import com.questrail.tracewire.packet.LogHeader;
import com.questrail.tracewire.packet.Packet;
import com.questrail.tracewire.protocol.scheduler.Scheduler;
import com.questrail.tracewire.protocol.scheduler.SchedulerCommand;
import com.questrail.tracewire.protocol.scheduler.SchedulerTarget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Protocol
 * =============================================================================
 * Connection lifecycle shared by every transport.
 *
 * <h2>State machine</h2>
 * <pre>
 *   DISCONNECTED ──connect──▶ CONNECTING ──ok──▶ CONNECTED
 *         ▲                        │                 │
 *         └────────failure─────────┴──failure/disconnect
 * </pre>
 * Subclasses supply the transport primitives {@link #internalConnect()},
 * {@link #internalWritePacket(Packet)}, {@link #internalDisconnect()} and
 * optionally {@link #internalDispatch(ProtocolCommand)}; this class owns
 * option handling, the level filter, the backlog, reconnects and the
 * asynchronous scheduler.
 *
 * <h2>Options</h2>
 * Common to all protocols: {@code caption}, {@code level}, {@code reconnect},
 * {@code reconnect.interval}, {@code backlog.enabled}, {@code backlog.queue},
 * {@code backlog.flushon}, {@code backlog.keepopen}, {@code async.enabled},
 * {@code async.queue}, {@code async.throttle},
 * {@code async.clearondisconnect}, plus the shorthands {@code backlog},
 * {@code flushon} and {@code keepopen}. An option the protocol does not know
 * is a {@link ConfigurationException}.
 *
 * <h2>Errors</h2>
 * Failures of a primitive reset the connection and become a
 * {@link ProtocolException}. In synchronous mode it is thrown to the caller;
 * in asynchronous mode it is reported to the registered sinks and never
 * thrown.
 *
 * <h2>Threading</h2>
 * Public operations are serialized on the protocol lock. In asynchronous mode
 * the primitives run only on the scheduler worker.
 */
public abstract class Protocol implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Protocol.class);

    private static final Set<String> COMMON_OPTIONS = Set.of(
        "caption",
        "level",
        "reconnect",
        "reconnect.interval",
        "backlog.enabled",
        "backlog.flushon",
        "backlog.keepopen",
        "backlog.queue",
        "async.enabled",
        "async.queue",
        "async.throttle",
        "async.clearondisconnect");

    static final long DEFAULT_QUEUE_KB = 2048;

    protected final MonotonicClock monotonicClock;
    protected final WallClock wallClock;

    private final Object lock = new Object();
    private final CompositeObservabilitySink sinks = new CompositeObservabilitySink();
    private final PacketQueue backlog = new PacketQueue(0);

    private ProtocolOptions options = ProtocolOptions.empty();
    private boolean initialized;

    private String caption = "";
    private Level level = Level.DEBUG;
    private boolean reconnect;
    private long reconnectIntervalMillis;
    private boolean backlogEnabled;
    private long backlogQueueBytes;
    private Level backlogFlushOn = Level.ERROR;
    private boolean backlogKeepOpen;
    private boolean asyncEnabled;
    private long asyncQueueBytes;
    private boolean asyncThrottle;
    private boolean asyncClearOnDisconnect;
    private boolean keepOpen = true;

    private volatile String appName = "";
    private volatile String hostName = "";

    private volatile boolean connected;
    private volatile boolean failed;
    private volatile ProtocolState state = ProtocolState.DISCONNECTED;
    private long reconnectNanos;
    private boolean reconnectStamped;

    private Scheduler scheduler;

    protected Protocol(MonotonicClock monotonicClock, WallClock wallClock) {
        this.monotonicClock = Objects.requireNonNull(monotonicClock, "monotonicClock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.caption = name();
    }

    protected Protocol() {
        this(SystemMonotonicClock.INSTANCE, SystemWallClock.INSTANCE);
    }

    /**
     * Protocol name as used in connections strings ({@code tcp},
     * {@code file}, ...).
     */
    public abstract String name();

    // -------------------------------------------------------------------------
    // Options
    // -------------------------------------------------------------------------

    /**
     * Parses {@code rawOptions} and loads them. Subsequent calls are ignored.
     */
    public void initialize(String rawOptions) {
        synchronized (lock) {
            if (initialized) {
                return;
            }
            loadOptions(ProtocolOptions.of(
                new OptionsParser().parse(name(), rawOptions == null ? "" : rawOptions)));
        }
    }

    /**
     * Validates every option name, expands the backlog shorthands and
     * applies the values.
     *
     * @throws ConfigurationException for an option this protocol does not support
     */
    public void loadOptions(ProtocolOptions options) {
        Objects.requireNonNull(options, "options");
        synchronized (lock) {
            Map<String, String> expanded = new LinkedHashMap<>();
            for (Map.Entry<String, String> e : options.asMap().entrySet()) {
                String key = e.getKey();
                if (!mapShorthand(key, e.getValue(), expanded)) {
                    if (!isValidOption(key)) {
                        throw new ConfigurationException(
                            "Option \"" + key + "\" is not available for protocol \"" + name() + "\"");
                    }
                    expanded.put(key, e.getValue());
                }
            }

            ProtocolOptions.Builder builder = ProtocolOptions.builder();
            expanded.forEach(builder::with);
            this.options = builder.build();
            applyOptions(this.options);
            initialized = true;
        }
    }

    /**
     * Whether {@code name} is an option this protocol understands.
     * Subclasses extend the set and fall back to {@code super}.
     */
    public boolean isValidOption(String name) {
        return COMMON_OPTIONS.contains(name.toLowerCase(Locale.ROOT));
    }

    /**
     * Reads option values into fields. Subclasses override, call
     * {@code super} first, then read their own options.
     */
    protected void applyOptions(ProtocolOptions options) {
        level = options.getLevel("level", Level.DEBUG);
        reconnect = options.getBoolean("reconnect", false);
        reconnectIntervalMillis = options.getTimespanMillis("reconnect.interval", 0);
        caption = options.getString("caption", name());

        backlogEnabled = options.getBoolean("backlog.enabled", false);
        backlogQueueBytes = options.getSizeBytes("backlog.queue", DEFAULT_QUEUE_KB);
        backlogFlushOn = options.getLevel("backlog.flushon", Level.ERROR);
        backlogKeepOpen = options.getBoolean("backlog.keepopen", false);
        backlog.setBacklog(backlogQueueBytes);
        keepOpen = !backlogEnabled || backlogKeepOpen;

        asyncEnabled = options.getBoolean("async.enabled", false);
        asyncThrottle = options.getBoolean("async.throttle", false);
        asyncQueueBytes = options.getSizeBytes("async.queue", DEFAULT_QUEUE_KB);
        asyncClearOnDisconnect = options.getBoolean("async.clearondisconnect", false);
    }

    /**
     * Renders the effective option values. Subclasses append theirs after
     * calling {@code super}.
     */
    protected void buildOptions(ConnectionsBuilder builder) {
        builder.addOption("async.enabled", asyncEnabled);
        builder.addOption("async.clearondisconnect", asyncClearOnDisconnect);
        builder.addOption("async.queue", asyncQueueBytes / 1024);
        builder.addOption("async.throttle", asyncThrottle);
        builder.addOption("backlog.enabled", backlogEnabled);
        builder.addOption("backlog.flushon", backlogFlushOn);
        builder.addOption("backlog.keepopen", backlogKeepOpen);
        builder.addOption("backlog.queue", backlogQueueBytes / 1024);
        builder.addOption("level", level);
        builder.addOption("caption", caption);
        builder.addOption("reconnect", reconnect);
        builder.addOption("reconnect.interval", reconnectIntervalMillis / 1000 + "s");
    }

    /**
     * Effective options as an option string, for diagnostics.
     */
    public String describeOptions() {
        ConnectionsBuilder builder = new ConnectionsBuilder();
        builder.beginProtocol(name());
        buildOptions(builder);
        builder.endProtocol();
        String s = builder.toString();
        return s.substring(name().length() + 1, s.length() - 1);
    }

    private static boolean mapShorthand(String key, String value, Map<String, String> out) {
        switch (key) {
            case "backlog" -> {
                long bytes = ProtocolOptions.builder().with("backlog", value).build()
                    .getSizeBytes("backlog", 0);
                if (bytes > 0) {
                    out.put("backlog.enabled", "true");
                    out.put("backlog.queue", value);
                } else {
                    out.put("backlog.enabled", "false");
                    out.put("backlog.queue", "0");
                }
                return true;
            }
            case "flushon" -> {
                out.put("backlog.flushon", value);
                return true;
            }
            case "keepopen" -> {
                out.put("backlog.keepopen", value);
                return true;
            }
            default -> {
                return false;
            }
        }
    }

    // -------------------------------------------------------------------------
    // Public operations
    // -------------------------------------------------------------------------

    public void connect() {
        synchronized (lock) {
            if (asyncEnabled) {
                if (scheduler != null) {
                    return;
                }
                try {
                    startScheduler();
                    scheduler.schedule(SchedulerCommand.connect());
                } catch (RuntimeException e) {
                    handleException(e);
                }
            } else {
                implConnect();
            }
        }
    }

    /**
     * Writes a packet, or queues it in asynchronous mode. Packets below the
     * configured level are ignored.
     */
    public void writePacket(Packet packet) {
        Objects.requireNonNull(packet, "packet");
        synchronized (lock) {
            if (packet.level().compareTo(level) < 0) {
                return;
            }
            if (asyncEnabled) {
                if (scheduler == null) {
                    return;
                }
                if (!scheduler.schedule(SchedulerCommand.writePacket(packet))) {
                    log.warn("Protocol {} [{}]: asynchronous queue full, packet dropped", name(), caption);
                    sinks.onError(new ProtocolErrorEvent(wallClock.now(), name(), caption,
                        "Asynchronous queue full, packet dropped", null));
                }
            } else {
                implWritePacket(packet);
            }
        }
    }

    public void disconnect() {
        synchronized (lock) {
            if (asyncEnabled) {
                if (scheduler == null) {
                    return;
                }
                if (asyncClearOnDisconnect) {
                    scheduler.clear();
                }
                scheduler.schedule(SchedulerCommand.disconnect());
                stopScheduler();
            } else {
                implDisconnect();
            }
        }
    }

    public void dispatch(ProtocolCommand command) {
        Objects.requireNonNull(command, "command");
        synchronized (lock) {
            if (asyncEnabled) {
                if (scheduler == null) {
                    return;
                }
                scheduler.schedule(SchedulerCommand.dispatch(command));
            } else {
                implDispatch(command);
            }
        }
    }

    /**
     * Disconnects and unregisters all sinks.
     */
    @Override
    public void close() {
        try {
            disconnect();
        } finally {
            synchronized (lock) {
                sinks.clear();
            }
        }
    }

    public void addSink(ProtocolObservabilitySink sink) {
        sinks.add(sink);
    }

    public void removeSink(ProtocolObservabilitySink sink) {
        sinks.remove(sink);
    }

    // -------------------------------------------------------------------------
    // Accessors
    // -------------------------------------------------------------------------

    public String caption() {
        return caption;
    }

    public Level level() {
        return level;
    }

    public boolean isAsynchronous() {
        return asyncEnabled;
    }

    public boolean isFailed() {
        return failed;
    }

    public boolean isConnected() {
        return connected;
    }

    public ProtocolState state() {
        return state;
    }

    public ProtocolOptions options() {
        return options;
    }

    public String appName() {
        return appName;
    }

    public void setAppName(String appName) {
        this.appName = appName == null ? "" : appName;
    }

    public String hostName() {
        return hostName;
    }

    public void setHostName(String hostName) {
        this.hostName = hostName == null ? "" : hostName;
    }

    /** Queued scheduler commands; 0 in synchronous mode. */
    public int queuedCommands() {
        synchronized (lock) {
            return scheduler == null ? 0 : scheduler.queuedCount();
        }
    }

    /** Packets held back by the backlog. */
    public int backlogCount() {
        return backlog.count();
    }

    // -------------------------------------------------------------------------
    // Transport primitives
    // -------------------------------------------------------------------------

    /**
     * Checks option values the transport cannot work with. Runs before every
     * transport-level connect.
     *
     * @throws ConfigurationException for an unusable value
     */
    protected void validateOptions() {
    }

    protected abstract void internalConnect() throws IOException;

    /**
     * Reconnects after a failure. The default simply connects again.
     *
     * @return whether the protocol is connected afterwards
     */
    protected boolean internalReconnect() throws IOException {
        internalConnect();
        return true;
    }

    protected abstract void internalWritePacket(Packet packet) throws IOException;

    protected abstract void internalDisconnect() throws IOException;

    protected void internalDispatch(ProtocolCommand command) throws IOException {
    }

    /**
     * Writes the session preamble; used by socket-like protocols right after
     * their handshake.
     */
    protected void writeLogHeader() throws IOException {
        internalWritePacket(new LogHeader(appName, hostName));
    }

    protected void fireInfo(String message) {
        sinks.onInfo(new ProtocolInfoEvent(wallClock.now(), name(), caption, message));
    }

    // -------------------------------------------------------------------------
    // Implementation, shared by synchronous callers and the scheduler worker
    // -------------------------------------------------------------------------

    private void implConnect() {
        if (!connected && keepOpen) {
            try {
                try {
                    openTransport();
                } catch (IOException | RuntimeException e) {
                    reset();
                    throw e;
                }
            } catch (IOException | RuntimeException e) {
                handleException(e);
            }
        }
    }

    private void implWritePacket(Packet packet) {
        if (!connected && !reconnect && keepOpen) {
            return;
        }
        try {
            try {
                boolean hold = false;
                if (backlogEnabled) {
                    if (packet.level().isAtLeast(backlogFlushOn) && packet.level() != Level.CONTROL) {
                        flushBacklog();
                    } else {
                        backlog.push(packet);
                        hold = true;
                    }
                }
                if (!hold) {
                    forwardPacket(packet, !keepOpen);
                }
            } catch (IOException | RuntimeException e) {
                reset();
                throw e;
            }
        } catch (IOException | RuntimeException e) {
            handleException(e);
        }
    }

    private void implDisconnect() {
        if (connected) {
            try {
                reset();
            } catch (IOException | RuntimeException e) {
                handleException(e);
            }
        } else {
            backlog.clear();
        }
    }

    private void implDispatch(ProtocolCommand command) {
        if (connected) {
            try {
                internalDispatch(command);
            } catch (IOException | RuntimeException e) {
                handleException(e);
            }
        }
    }

    private void flushBacklog() throws IOException {
        Packet packet;
        while ((packet = backlog.pop()) != null) {
            forwardPacket(packet, false);
        }
    }

    private void forwardPacket(Packet packet, boolean disconnect) throws IOException {
        if (!connected) {
            if (!keepOpen) {
                openTransport();
            } else {
                reconnect();
            }
        }
        if (connected) {
            internalWritePacket(packet);
            if (disconnect) {
                markDisconnected();
                internalDisconnect();
            }
        }
    }

    private void openTransport() throws IOException {
        setState(ProtocolState.CONNECTING);
        validateOptions();
        internalConnect();
        markConnected();
    }

    private void reconnect() {
        if (reconnectIntervalMillis > 0 && reconnectStamped) {
            long elapsedMillis = (monotonicClock.nowNanos() - reconnectNanos) / 1_000_000L;
            if (elapsedMillis < reconnectIntervalMillis) {
                return;
            }
        }

        try {
            setState(ProtocolState.CONNECTING);
            validateOptions();
            if (internalReconnect()) {
                markConnected();
            }
        } catch (IOException | RuntimeException e) {
            log.debug("Protocol {} [{}]: reconnect failed: {}", name(), caption, e.getMessage());
        }

        failed = !connected;
        if (failed) {
            try {
                reset();
            } catch (IOException | RuntimeException e) {
                log.debug("Protocol {} [{}]: reset after failed reconnect failed", name(), caption, e);
            }
        }
    }

    /**
     * Drops the connection and the backlog; stamps the time used for the
     * reconnect interval.
     */
    protected void reset() throws IOException {
        markDisconnected();
        backlog.clear();
        try {
            internalDisconnect();
        } finally {
            reconnectNanos = monotonicClock.nowNanos();
            reconnectStamped = true;
        }
    }

    private void handleException(Exception e) {
        failed = true;
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        ProtocolException ex = e instanceof ProtocolException pe
            ? pe
            : new ProtocolException(message, name(), describeOptions(), e);
        if (asyncEnabled) {
            sinks.onError(new ProtocolErrorEvent(wallClock.now(), name(), caption, message, ex));
        } else {
            throw ex;
        }
    }

    private void markConnected() {
        connected = true;
        failed = false;
        setState(ProtocolState.CONNECTED);
    }

    private void markDisconnected() {
        connected = false;
        setState(ProtocolState.DISCONNECTED);
    }

    private void setState(ProtocolState newState) {
        ProtocolState old = state;
        if (old == newState) {
            return;
        }
        state = newState;
        sinks.onStateTransition(new ProtocolStateTransitionEvent(wallClock.now(), name(), caption, old, newState));
    }

    private void startScheduler() {
        Scheduler s = new Scheduler(new WorkerTarget(), "tracewire-" + caption, asyncQueueBytes, asyncThrottle);
        s.start();
        scheduler = s;
    }

    private void stopScheduler() {
        if (scheduler != null) {
            scheduler.stop();
            scheduler = null;
        }
    }

    private final class WorkerTarget implements SchedulerTarget {
        @Override
        public void runConnect() {
            implConnect();
        }

        @Override
        public void runWritePacket(Packet packet) {
            implWritePacket(packet);
        }

        @Override
        public void runDisconnect() {
            implDisconnect();
        }

        @Override
        public void runDispatch(ProtocolCommand command) {
            implDispatch(command);
        }

        @Override
        public boolean isFailed() {
            return failed;
        }
    }
}
