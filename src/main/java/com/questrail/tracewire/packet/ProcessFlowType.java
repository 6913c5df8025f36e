package com.questrail.tracewire.packet;

public enum ProcessFlowType {
    ENTER_METHOD,
    LEAVE_METHOD,
    ENTER_THREAD,
    LEAVE_THREAD,
    ENTER_PROCESS,
    LEAVE_PROCESS;

    public int id() {
        return ordinal();
    }

    public static ProcessFlowType fromId(int id) {
        ProcessFlowType[] all = values();
        if (id < 0 || id >= all.length) {
            throw new IllegalArgumentException("Unknown process flow type id: " + id);
        }
        return all[id];
    }
}
