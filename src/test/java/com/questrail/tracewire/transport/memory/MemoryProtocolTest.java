package com.questrail.tracewire.transport.memory;

import com.questrail.tracewire.codec.impl.BinaryPacketReader;
import com.questrail.tracewire.internal.time.ManualMonotonicClock;
import com.questrail.tracewire.internal.time.ManualWallClock;
import com.questrail.tracewire.packet.LogEntry;
import com.questrail.tracewire.packet.LogEntryType;
import com.questrail.tracewire.packet.Packet;
import com.questrail.tracewire.packet.ViewerId;
import com.questrail.tracewire.protocol.ProtocolCommand;
import com.questrail.tracewire.protocol.ProtocolException;
import com.questrail.tracewire.protocol.RecordingProtocol;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

final class MemoryProtocolTest {

    private final ManualMonotonicClock monotonicClock = new ManualMonotonicClock();
    private final ManualWallClock wallClock = ManualWallClock.at("2024-05-06T07:08:09Z");

    private MemoryProtocol protocol(String options) {
        MemoryProtocol protocol = new MemoryProtocol(monotonicClock, wallClock, ZoneOffset.UTC);
        protocol.initialize(options);
        return protocol;
    }

    private LogEntry entry(String title, int dataSize) {
        return LogEntry.builder(LogEntryType.MESSAGE, ViewerId.TITLE)
            .withTitle(title)
            .withData(new byte[dataSize])
            .withTimestamp(wallClock.now())
            .build();
    }

    private static List<String> titles(List<Packet> packets) {
        return packets.stream().map(p -> ((LogEntry) p).title()).collect(Collectors.toList());
    }

    @Test
    void dispatchToStreamWritesHeaderAndDrainsTheQueue() throws Exception {
        MemoryProtocol protocol = protocol("");
        protocol.connect();
        protocol.writePacket(entry("one", 0));
        protocol.writePacket(entry("two", 0));

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        protocol.dispatch(new ProtocolCommand(0, out));

        BinaryPacketReader reader = new BinaryPacketReader(new ByteArrayInputStream(out.toByteArray()));
        assertEquals("SILF", reader.readStreamHeader());
        assertEquals(List.of("one", "two"), titles(reader.readAll()));
        assertTrue(protocol.snapshot().isEmpty());
    }

    @Test
    void dispatchAsTextUsesPattern() {
        MemoryProtocol protocol = protocol("astext=true, pattern=\"%title%!\"");
        protocol.connect();
        protocol.writePacket(entry("hi", 0));

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        protocol.dispatch(new ProtocolCommand(0, out));

        ByteArrayOutputStream expected = new ByteArrayOutputStream();
        expected.writeBytes(new byte[] { (byte) 0xEF, (byte) 0xBB, (byte) 0xBF });
        expected.writeBytes("hi!\r\n".getBytes(StandardCharsets.UTF_8));
        assertArrayEquals(expected.toByteArray(), out.toByteArray());
    }

    @Test
    void dispatchToProtocolForwardsEveryPacket() {
        MemoryProtocol protocol = protocol("");
        RecordingProtocol target = new RecordingProtocol(monotonicClock, wallClock);
        target.connect();
        protocol.connect();
        protocol.writePacket(entry("a", 0));
        protocol.writePacket(entry("b", 0));

        protocol.dispatch(new ProtocolCommand(0, target));

        assertEquals(List.of("a", "b"), titles(target.written()));
    }

    @Test
    void oldestPacketsAreDiscardedBeyondMaxSize() {
        MemoryProtocol protocol = protocol("maxsize=1");
        protocol.connect();
        for (int i = 0; i < 5; i++) {
            protocol.writePacket(entry("p" + i, 300));
        }

        List<String> kept = titles(protocol.snapshot());
        assertEquals(List.of("p3", "p4"), kept);
    }

    @Test
    void unsupportedDispatchTargetFails() {
        MemoryProtocol protocol = protocol("");
        protocol.connect();

        assertThrows(ProtocolException.class, () -> protocol.dispatch(new ProtocolCommand(0, "nowhere")));
    }

    @Test
    void snapshotIsSafeWhileTheAsyncWorkerWrites() {
        MemoryProtocol protocol = protocol("async.enabled=true, maxsize=4");
        protocol.connect();

        for (int i = 0; i < 2_000; i++) {
            protocol.writePacket(entry("p" + i, 16));
            List<Packet> snapshot = protocol.snapshot();
            assertFalse(snapshot.contains(null));
        }
        protocol.disconnect();

        assertTrue(protocol.snapshot().isEmpty());
    }

    @Test
    void disconnectDropsHeldPackets() {
        MemoryProtocol protocol = protocol("");
        protocol.connect();
        protocol.writePacket(entry("a", 0));

        protocol.disconnect();

        assertTrue(protocol.snapshot().isEmpty());
    }

    @Test
    void defaultMaxSizeIsEightMegabytes() {
        assertEquals(8L * 1024 * 1024, protocol("").maxSize());
    }
}
