package com.questrail.tracewire.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Fans events out to registered sinks in registration order.
 *
 * <p>A sink that throws is logged and skipped; the remaining sinks still
 * receive the event and the caller never sees the failure.</p>
 */
public final class CompositeObservabilitySink implements ProtocolObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(CompositeObservabilitySink.class);

    private final List<ProtocolObservabilitySink> sinks = new CopyOnWriteArrayList<>();

    public void add(ProtocolObservabilitySink sink) {
        sinks.add(Objects.requireNonNull(sink, "sink"));
    }

    public void remove(ProtocolObservabilitySink sink) {
        sinks.remove(sink);
    }

    public void clear() {
        sinks.clear();
    }

    public boolean isEmpty() {
        return sinks.isEmpty();
    }

    @Override
    public void onStateTransition(ProtocolStateTransitionEvent event) {
        for (ProtocolObservabilitySink sink : sinks) {
            try {
                sink.onStateTransition(event);
            } catch (RuntimeException e) {
                log.warn("Observability sink {} failed on state transition", sink, e);
            }
        }
    }

    @Override
    public void onInfo(ProtocolInfoEvent event) {
        for (ProtocolObservabilitySink sink : sinks) {
            try {
                sink.onInfo(event);
            } catch (RuntimeException e) {
                log.warn("Observability sink {} failed on info event", sink, e);
            }
        }
    }

    @Override
    public void onError(ProtocolErrorEvent event) {
        for (ProtocolObservabilitySink sink : sinks) {
            try {
                sink.onError(event);
            } catch (RuntimeException e) {
                log.warn("Observability sink {} failed on error event", sink, e);
            }
        }
    }
}
