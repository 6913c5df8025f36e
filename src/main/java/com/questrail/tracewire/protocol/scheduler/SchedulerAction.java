package com.questrail.tracewire.protocol.scheduler;

public enum SchedulerAction {
    CONNECT,
    WRITE_PACKET,
    DISCONNECT,
    DISPATCH
}
