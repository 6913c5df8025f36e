package com.questrail.tracewire.packet;

public enum WatchType {
    CHAR,
    STRING,
    INTEGER,
    FLOAT,
    BOOLEAN,
    ADDRESS,
    TIMESTAMP,
    OBJECT;

    public int id() {
        return ordinal();
    }

    public static WatchType fromId(int id) {
        WatchType[] all = values();
        if (id < 0 || id >= all.length) {
            throw new IllegalArgumentException("Unknown watch type id: " + id);
        }
        return all[id];
    }
}
