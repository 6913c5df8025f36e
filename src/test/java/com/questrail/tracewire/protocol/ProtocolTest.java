package com.questrail.tracewire.protocol;

import com.questrail.tracewire.config.ConfigurationException;
import com.questrail.tracewire.internal.time.ManualMonotonicClock;
import com.questrail.tracewire.internal.time.ManualWallClock;
import com.questrail.tracewire.observability.ProtocolErrorEvent;
import com.questrail.tracewire.observability.ProtocolInfoEvent;
import com.questrail.tracewire.observability.RecordingObservabilitySink;
import com.questrail.tracewire.packet.Level;
import com.questrail.tracewire.packet.LogEntry;
import com.questrail.tracewire.packet.LogEntryType;
import com.questrail.tracewire.packet.Packet;
import com.questrail.tracewire.packet.ViewerId;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class ProtocolTest {

    private final ManualMonotonicClock monotonicClock = new ManualMonotonicClock();
    private final ManualWallClock wallClock = ManualWallClock.at("2024-01-01T00:00:00Z");
    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();

    private RecordingProtocol protocol(String options) {
        RecordingProtocol protocol = new RecordingProtocol(monotonicClock, wallClock);
        protocol.addSink(sink);
        protocol.initialize(options);
        return protocol;
    }

    private static Packet entry(Level level, String title) {
        return LogEntry.builder(LogEntryType.MESSAGE, ViewerId.TITLE)
            .withLevel(level)
            .withTitle(title)
            .withTimestamp(Instant.parse("2024-01-01T00:00:00Z"))
            .build();
    }

    private static String title(Packet p) {
        return ((LogEntry) p).title();
    }

    @Test
    void connectWriteDisconnectWalksTheStates() {
        RecordingProtocol protocol = protocol("");

        protocol.connect();
        assertTrue(protocol.isConnected());
        protocol.writePacket(entry(Level.MESSAGE, "one"));
        protocol.disconnect();

        assertFalse(protocol.isConnected());
        assertEquals(1, protocol.written().size());
        assertEquals(List.of(ProtocolState.CONNECTING, ProtocolState.CONNECTED, ProtocolState.DISCONNECTED),
            sink.getStates());
    }

    @Test
    void packetsBelowTheLevelAreIgnored() {
        RecordingProtocol protocol = protocol("level=warning");
        protocol.connect();

        protocol.writePacket(entry(Level.MESSAGE, "quiet"));
        protocol.writePacket(entry(Level.ERROR, "loud"));

        assertEquals(List.of("loud"), protocol.written().stream().map(ProtocolTest::title).toList());
    }

    @Test
    void writesBeforeConnectAreDropped() {
        RecordingProtocol protocol = protocol("");

        protocol.writePacket(entry(Level.MESSAGE, "early"));

        assertTrue(protocol.written().isEmpty());
    }

    @Test
    void unknownOptionIsAConfigurationError() {
        RecordingProtocol protocol = new RecordingProtocol(monotonicClock, wallClock);

        ConfigurationException e = assertThrows(ConfigurationException.class,
            () -> protocol.initialize("colour=red"));
        assertTrue(e.getMessage().contains("colour"));
    }

    @Test
    void synchronousFailureIsThrownWithContext() {
        RecordingProtocol protocol = protocol("caption=primary");
        protocol.failConnect(true);

        ProtocolException e = assertThrows(ProtocolException.class, protocol::connect);

        assertEquals("recording", e.protocolName());
        assertTrue(e.protocolOptions().contains("caption=\"primary\""));
        assertTrue(e.getMessage().contains("connection refused"));
        assertFalse(protocol.isConnected());
        assertTrue(protocol.isFailed());
        assertEquals(ProtocolState.DISCONNECTED, protocol.state());
    }

    @Test
    void failedWriteResetsTheConnection() {
        RecordingProtocol protocol = protocol("");
        protocol.connect();
        protocol.failWrite(true);

        assertThrows(ProtocolException.class, () -> protocol.writePacket(entry(Level.MESSAGE, "x")));

        assertFalse(protocol.isConnected());
        assertEquals(1, protocol.disconnects());
    }

    @Test
    void reconnectWaitsForTheInterval() {
        RecordingProtocol protocol = protocol("reconnect=true, reconnect.interval=10s");
        protocol.failConnect(true);
        assertThrows(ProtocolException.class, protocol::connect);

        protocol.failConnect(false);
        protocol.writePacket(entry(Level.MESSAGE, "too soon"));
        assertTrue(protocol.written().isEmpty());
        assertEquals(0, protocol.connects());

        monotonicClock.advanceMillis(10_000);
        protocol.writePacket(entry(Level.MESSAGE, "retry"));

        assertTrue(protocol.isConnected());
        assertEquals(List.of("retry"), protocol.written().stream().map(ProtocolTest::title).toList());
    }

    @Test
    void backlogHoldsPacketsUntilFlushLevel() {
        RecordingProtocol protocol = protocol("backlog=64, flushon=error, keepopen=true");
        protocol.connect();

        protocol.writePacket(entry(Level.DEBUG, "a"));
        protocol.writePacket(entry(Level.MESSAGE, "b"));
        assertTrue(protocol.written().isEmpty());
        assertEquals(2, protocol.backlogCount());

        protocol.writePacket(entry(Level.ERROR, "c"));

        assertEquals(List.of("a", "b", "c"), protocol.written().stream().map(ProtocolTest::title).toList());
        assertEquals(0, protocol.backlogCount());
    }

    @Test
    void backlogWithoutKeepOpenConnectsOnlyToFlush() {
        RecordingProtocol protocol = protocol("backlog.enabled=true, backlog.queue=64, backlog.flushon=warning");
        protocol.connect();
        assertFalse(protocol.isConnected());

        protocol.writePacket(entry(Level.MESSAGE, "held"));
        assertEquals(0, protocol.connects());

        protocol.writePacket(entry(Level.WARNING, "flush"));

        assertEquals(List.of("held", "flush"), protocol.written().stream().map(ProtocolTest::title).toList());
        assertEquals(1, protocol.connects());
        assertFalse(protocol.isConnected());
    }

    @Test
    void asynchronousWritesRunOnTheWorker() {
        RecordingProtocol protocol = protocol("async.enabled=true, caption=bg");
        assertTrue(protocol.isAsynchronous());

        protocol.connect();
        for (int i = 0; i < 20; i++) {
            protocol.writePacket(entry(Level.MESSAGE, "m" + i));
        }
        protocol.disconnect();

        assertEquals(20, protocol.written().size());
        assertEquals("m0", title(protocol.written().get(0)));
        assertEquals("m19", title(protocol.written().get(19)));
        assertEquals(0, protocol.queuedCommands());
    }

    @Test
    void packetThatCannotFitTheAsyncQueueIsDroppedAndReported() throws InterruptedException {
        RecordingProtocol protocol = protocol("async.enabled=true, async.queue=1");
        protocol.holdWrites();
        protocol.connect();
        protocol.writePacket(entry(Level.MESSAGE, "first"));
        assertTrue(protocol.awaitHeldWrite());

        Packet oversized = LogEntry.builder(LogEntryType.MESSAGE, ViewerId.DATA)
            .withTitle("oversized")
            .withData(new byte[2048])
            .withTimestamp(Instant.parse("2024-01-01T00:00:00Z"))
            .build();
        assertDoesNotThrow(() -> protocol.writePacket(oversized));
        protocol.writePacket(entry(Level.MESSAGE, "second"));

        protocol.releaseWrites();
        protocol.disconnect();

        List<ProtocolErrorEvent> errors = sink.getErrors();
        assertEquals(1, errors.size());
        assertEquals("recording", errors.get(0).protocolName());
        assertEquals("Asynchronous queue full, packet dropped", errors.get(0).message());
        assertEquals(List.of("first", "second"), protocol.written().stream().map(ProtocolTest::title).toList());
    }

    @Test
    void asynchronousFailureGoesToSinksNotCaller() {
        RecordingProtocol protocol = protocol("async.enabled=true");
        protocol.failConnect(true);

        assertDoesNotThrow(protocol::connect);
        assertDoesNotThrow(() -> protocol.writePacket(entry(Level.MESSAGE, "x")));
        protocol.disconnect();

        List<ProtocolErrorEvent> errors = sink.getErrors();
        assertEquals(1, errors.size());
        assertEquals("recording", errors.get(0).protocolName());
        assertInstanceOf(ProtocolException.class, errors.get(0).cause());
    }

    @Test
    void dispatchReachesTheTransport() {
        RecordingProtocol protocol = protocol("");
        protocol.connect();

        protocol.dispatch(new ProtocolCommand(3, "state"));

        assertEquals(List.of(new ProtocolCommand(3, "state")), protocol.dispatched());
    }

    @Test
    void describeOptionsRendersEffectiveValues() {
        RecordingProtocol protocol = protocol("level=error, async.queue=16");

        String description = protocol.describeOptions();

        assertTrue(description.contains("level=\"error\""));
        assertTrue(description.contains("async.queue=\"16\""));
        assertTrue(description.contains("async.throttle=\"false\""));
    }

    @Test
    void closeDisconnectsAndDropsSinks() {
        RecordingProtocol protocol = protocol("");
        protocol.connect();
        int before = sink.getAllEvents().size();

        protocol.close();

        assertFalse(protocol.isConnected());
        assertEquals(before + 1, sink.getAllEvents().size());
        protocol.connect();
        assertEquals(before + 1, sink.getAllEvents().size());
        assertFalse(sink.hasEventOfType(ProtocolInfoEvent.class));
    }
}
