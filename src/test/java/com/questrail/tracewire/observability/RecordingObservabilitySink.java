package com.questrail.tracewire.observability;

import com.questrail.tracewire.protocol.ProtocolState;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements ProtocolObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onStateTransition(ProtocolStateTransitionEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onInfo(ProtocolInfoEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onError(ProtocolErrorEvent event) {
        events.add(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized List<ProtocolErrorEvent> getErrors() {
        return events.stream()
            .filter(e -> e instanceof ProtocolErrorEvent)
            .map(e -> (ProtocolErrorEvent) e)
            .collect(Collectors.toList());
    }

    public synchronized List<ProtocolInfoEvent> getInfos() {
        return events.stream()
            .filter(e -> e instanceof ProtocolInfoEvent)
            .map(e -> (ProtocolInfoEvent) e)
            .collect(Collectors.toList());
    }

    public synchronized List<ProtocolState> getStates() {
        return events.stream()
            .filter(e -> e instanceof ProtocolStateTransitionEvent)
            .map(e -> ((ProtocolStateTransitionEvent) e).newState())
            .collect(Collectors.toList());
    }

    public synchronized <T> boolean hasEventOfType(Class<T> type) {
        return events.stream().anyMatch(type::isInstance);
    }
}
