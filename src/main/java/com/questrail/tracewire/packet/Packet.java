package com.questrail.tracewire.packet;

/**
 * Packet
 * =============================================================================
 * One unit of telemetry handed to a protocol.
 *
 * <p>Packets are immutable records; a packet may be held by several queues
 * (scheduler queue, backlog, memory buffer) and written to several protocols
 * without copying.</p>
 *
 * <h2>Size accounting</h2>
 * {@link #size()} is an estimate used by queues to enforce their byte
 * budgets (two bytes per string character plus a fixed header size per
 * packet kind). The exact serialized size is computed by the formatter.
 */
public sealed interface Packet permits LogEntry, Watch, ProcessFlow, ControlCommand, LogHeader {

    PacketType packetType();

    Level level();

    int size();

    static int stringSize(String s) {
        return s == null ? 0 : s.length() * 2;
    }
}
