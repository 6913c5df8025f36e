package com.questrail.tracewire.observability;

import java.time.Instant;

/**
 * Record representing a failure caught at a protocol or runtime boundary.
 * {@code protocolName} and {@code caption} are empty for runtime-level
 * errors that concern no single protocol.
 */
public record ProtocolErrorEvent(
    Instant timestamp,
    String protocolName,
    String caption,
    String message,
    Throwable cause
) {
}
