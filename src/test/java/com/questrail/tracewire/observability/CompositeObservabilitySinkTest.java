package com.questrail.tracewire.observability;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class CompositeObservabilitySinkTest {

    private static final class ThrowingSink implements ProtocolObservabilitySink {
        @Override
        public void onStateTransition(ProtocolStateTransitionEvent event) {
            throw new IllegalStateException("boom");
        }

        @Override
        public void onInfo(ProtocolInfoEvent event) {
            throw new IllegalStateException("boom");
        }

        @Override
        public void onError(ProtocolErrorEvent event) {
            throw new IllegalStateException("boom");
        }
    }

    @Test
    void throwingSinkDoesNotStarveTheOthers() {
        CompositeObservabilitySink composite = new CompositeObservabilitySink();
        RecordingObservabilitySink recording = new RecordingObservabilitySink();
        composite.add(new ThrowingSink());
        composite.add(recording);

        composite.onInfo(new ProtocolInfoEvent(Instant.EPOCH, "tcp", "tcp", "hello"));
        composite.onError(new ProtocolErrorEvent(Instant.EPOCH, "tcp", "tcp", "failed", null));

        assertEquals(2, recording.getAllEvents().size());
        assertTrue(recording.hasEventOfType(ProtocolInfoEvent.class));
        assertTrue(recording.hasEventOfType(ProtocolErrorEvent.class));
    }

    @Test
    void removedSinkNoLongerReceivesEvents() {
        CompositeObservabilitySink composite = new CompositeObservabilitySink();
        RecordingObservabilitySink recording = new RecordingObservabilitySink();
        composite.add(recording);
        composite.remove(recording);

        composite.onInfo(new ProtocolInfoEvent(Instant.EPOCH, "mem", "mem", "ignored"));

        assertTrue(recording.getAllEvents().isEmpty());
        assertTrue(composite.isEmpty());
    }

    @Test
    void slf4jSinkAcceptsEveryEventKind() {
        Slf4jProtocolObservabilitySink slf4j = new Slf4jProtocolObservabilitySink();

        assertDoesNotThrow(() -> {
            slf4j.onInfo(new ProtocolInfoEvent(Instant.EPOCH, "tcp", "main", "banner"));
            slf4j.onError(new ProtocolErrorEvent(Instant.EPOCH, "", "main", "no caption", null));
            slf4j.onError(new ProtocolErrorEvent(Instant.EPOCH, "tcp", "main", "failed", new RuntimeException("x")));
        });
    }
}
