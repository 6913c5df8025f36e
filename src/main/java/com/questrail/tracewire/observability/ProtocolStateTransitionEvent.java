package com.questrail.tracewire.observability;

import com.questrail.tracewire.protocol.ProtocolState;

import java.time.Instant;

/**
 * Record of a protocol connection state change.
 */
public record ProtocolStateTransitionEvent(
    Instant timestamp,
    String protocolName,
    String caption,
    ProtocolState oldState,
    ProtocolState newState
) {
}
