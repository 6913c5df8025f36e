package com.questrail.tracewire.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of ProtocolObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jProtocolObservabilitySink implements ProtocolObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jProtocolObservabilitySink.class);

    @Override
    public void onStateTransition(ProtocolStateTransitionEvent event) {
        log.info("Protocol {} [{}]: {} -> {}",
            event.protocolName(),
            event.caption(),
            event.oldState(),
            event.newState());
    }

    @Override
    public void onInfo(ProtocolInfoEvent event) {
        log.info("Protocol {} [{}]: {}", event.protocolName(), event.caption(), event.message());
    }

    @Override
    public void onError(ProtocolErrorEvent event) {
        if (event.protocolName().isEmpty()) {
            log.error("Tracewire error: {}", event.message(), event.cause());
        } else {
            log.error("Protocol {} [{}] error: {}",
                event.protocolName(), event.caption(), event.message(), event.cause());
        }
    }
}
