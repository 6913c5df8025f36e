package com.questrail.tracewire.packet;

/**
 * Wire identifier of each packet kind. The id is the first field of every
 * serialized packet header.
 */
public enum PacketType {
    CONTROL_COMMAND(1),
    LOG_ENTRY(4),
    WATCH(5),
    PROCESS_FLOW(6),
    LOG_HEADER(7);

    private final int id;

    PacketType(int id) {
        this.id = id;
    }

    public int id() {
        return id;
    }

    public static PacketType fromId(int id) {
        for (PacketType t : values()) {
            if (t.id == id) {
                return t;
            }
        }
        throw new IllegalArgumentException("Unknown packet type id: " + id);
    }
}
