package com.questrail.tracewire.transport;

import com.questrail.tracewire.config.ConfigurationException;
import com.questrail.tracewire.internal.time.MonotonicClock;
import com.questrail.tracewire.internal.time.SystemMonotonicClock;
import com.questrail.tracewire.internal.time.SystemWallClock;
import com.questrail.tracewire.internal.time.WallClock;
import com.questrail.tracewire.protocol.Protocol;

import java.util.Objects;

/**
 * ProtocolFactory
 * =============================================================================
 * Creates and initializes protocols from connections-string sections.
 *
 * <p>Protocols created by one factory share its clocks.</p>
 */
public final class ProtocolFactory {

    private final MonotonicClock monotonicClock;
    private final WallClock wallClock;

    public ProtocolFactory(MonotonicClock monotonicClock, WallClock wallClock) {
        this.monotonicClock = Objects.requireNonNull(monotonicClock, "monotonicClock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    public ProtocolFactory() {
        this(SystemMonotonicClock.INSTANCE, SystemWallClock.INSTANCE);
    }

    /**
     * Creates the protocol called {@code name} and initializes it with
     * {@code rawOptions}.
     *
     * @throws ConfigurationException for an unknown protocol name or an
     *         option the protocol rejects
     */
    public Protocol create(String name, String rawOptions) {
        ProtocolKind kind = ProtocolKind.fromName(name)
            .orElseThrow(() -> new ConfigurationException("Protocol \"" + name + "\" not found"));
        Protocol protocol = kind.newInstance(monotonicClock, wallClock);
        protocol.initialize(rawOptions);
        return protocol;
    }
}
