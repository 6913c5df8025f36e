package com.questrail.tracewire.transport;

import com.questrail.tracewire.internal.time.MonotonicClock;
import com.questrail.tracewire.internal.time.WallClock;
import com.questrail.tracewire.protocol.Protocol;
import com.questrail.tracewire.transport.file.FileProtocol;
import com.questrail.tracewire.transport.file.TextProtocol;
import com.questrail.tracewire.transport.memory.MemoryProtocol;
import com.questrail.tracewire.transport.pipe.PipeEndpointFactory;
import com.questrail.tracewire.transport.pipe.PipeProtocol;
import com.questrail.tracewire.transport.tcp.TcpEndpointFactory;
import com.questrail.tracewire.transport.tcp.TcpProtocol;

import java.time.ZoneId;
import java.util.Locale;
import java.util.Optional;
import java.util.function.BiFunction;

/**
 * The closed set of transports a connections string can name.
 */
public enum ProtocolKind {
    TCP("tcp", (mono, wall) -> new TcpProtocol(TcpEndpointFactory.NETTY, mono, wall)),
    PIPE("pipe", (mono, wall) -> new PipeProtocol(PipeEndpointFactory.WINDOWS, mono, wall)),
    FILE("file", FileProtocol::new),
    TEXT("text", (mono, wall) -> new TextProtocol(mono, wall, ZoneId.systemDefault())),
    MEMORY("mem", (mono, wall) -> new MemoryProtocol(mono, wall, ZoneId.systemDefault()));

    private final String protocolName;
    private final BiFunction<MonotonicClock, WallClock, Protocol> constructor;

    ProtocolKind(String protocolName, BiFunction<MonotonicClock, WallClock, Protocol> constructor) {
        this.protocolName = protocolName;
        this.constructor = constructor;
    }

    public String protocolName() {
        return protocolName;
    }

    Protocol newInstance(MonotonicClock monotonicClock, WallClock wallClock) {
        return constructor.apply(monotonicClock, wallClock);
    }

    /**
     * Looks a kind up by its connections-string name, ignoring case and
     * surrounding whitespace.
     */
    public static Optional<ProtocolKind> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String n = name.trim().toLowerCase(Locale.ROOT);
        for (ProtocolKind kind : values()) {
            if (kind.protocolName.equals(n)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
