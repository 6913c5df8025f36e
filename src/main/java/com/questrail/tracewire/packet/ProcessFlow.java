package com.questrail.tracewire.packet;

import java.time.Instant;
import java.util.Objects;

/**
 * Enter/leave marker for methods, threads and processes.
 */
public record ProcessFlow(
    Level level,
    ProcessFlowType processFlowType,
    String title,
    String hostName,
    int processId,
    int threadId,
    Instant timestamp
) implements Packet {

    static final int HEADER_SIZE = 28;

    public ProcessFlow {
        Objects.requireNonNull(level, "level");
        Objects.requireNonNull(processFlowType, "processFlowType");
        Objects.requireNonNull(timestamp, "timestamp");
        title = Packets.nullToEmpty(title);
        hostName = Packets.nullToEmpty(hostName);
    }

    @Override
    public PacketType packetType() {
        return PacketType.PROCESS_FLOW;
    }

    @Override
    public int size() {
        return HEADER_SIZE + Packet.stringSize(title) + Packet.stringSize(hostName);
    }
}
