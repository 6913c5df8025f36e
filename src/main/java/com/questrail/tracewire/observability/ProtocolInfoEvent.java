package com.questrail.tracewire.observability;

import java.time.Instant;

public record ProtocolInfoEvent(
    Instant timestamp,
    String protocolName,
    String caption,
    String message
) {
}
