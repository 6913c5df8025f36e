package com.questrail.tracewire.codec.impl;

/**
 * Constants of the binary packet layout.
 *
 * <pre>
 *   [ uint16 packetType ][ int32 bodySize ][ body ... ]
 * </pre>
 * All integers are little-endian.
 */
final class WireFormat {

    /** Packet type (2) plus body size (4). */
    static final int PACKET_HEADER_SIZE = 6;

    static final int LOG_ENTRY_FIXED = 48;
    static final int WATCH_FIXED = 20;
    static final int PROCESS_FLOW_FIXED = 28;
    static final int CONTROL_COMMAND_FIXED = 8;
    static final int LOG_HEADER_FIXED = 4;

    private WireFormat() {
    }
}
