package com.questrail.tracewire.protocol;

/**
 * Connection state of a protocol. Any failure returns a protocol to
 * {@link #DISCONNECTED}.
 */
public enum ProtocolState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED
}
