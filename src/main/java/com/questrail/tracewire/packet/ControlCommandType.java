package com.questrail.tracewire.packet;

public enum ControlCommandType {
    CLEAR_LOG,
    CLEAR_WATCHES,
    CLEAR_AUTO_VIEWS,
    CLEAR_ALL,
    CLEAR_PROCESS_FLOW;

    public int id() {
        return ordinal();
    }

    public static ControlCommandType fromId(int id) {
        ControlCommandType[] all = values();
        if (id < 0 || id >= all.length) {
            throw new IllegalArgumentException("Unknown control command type id: " + id);
        }
        return all[id];
    }
}
