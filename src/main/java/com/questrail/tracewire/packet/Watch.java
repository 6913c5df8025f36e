package com.questrail.tracewire.packet;

import java.time.Instant;
import java.util.Objects;

/**
 * A named variable value displayed in the console's watch view.
 */
public record Watch(
    Level level,
    String name,
    String value,
    WatchType watchType,
    Instant timestamp
) implements Packet {

    static final int HEADER_SIZE = 20;

    public Watch {
        Objects.requireNonNull(level, "level");
        Objects.requireNonNull(watchType, "watchType");
        Objects.requireNonNull(timestamp, "timestamp");
        name = Packets.nullToEmpty(name);
        value = Packets.nullToEmpty(value);
    }

    public static Watch of(String name, String value, WatchType watchType, Instant timestamp) {
        return new Watch(Level.MESSAGE, name, value, watchType, timestamp);
    }

    @Override
    public PacketType packetType() {
        return PacketType.WATCH;
    }

    @Override
    public int size() {
        return HEADER_SIZE + Packet.stringSize(name) + Packet.stringSize(value);
    }
}
