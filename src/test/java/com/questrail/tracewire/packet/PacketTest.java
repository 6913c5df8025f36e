package com.questrail.tracewire.packet;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class PacketTest {

    @Test
    void levelParsing() {
        assertEquals(Level.WARNING, Level.parse(" Warning ", Level.DEBUG));
        assertEquals(Level.DEBUG, Level.parse("loud", Level.DEBUG));
        assertEquals(Level.MESSAGE, Level.parse(null, Level.MESSAGE));
        assertTrue(Level.ERROR.isAtLeast(Level.WARNING));
        assertFalse(Level.VERBOSE.isAtLeast(Level.MESSAGE));
    }

    @Test
    void logHeaderContentAndLevel() {
        LogHeader header = new LogHeader("billing", "node-7");

        assertEquals("hostname=node-7\r\nappname=billing\r\n", header.content());
        assertEquals(Level.CONTROL, header.level());
        assertEquals(4 + header.content().length() * 2, header.size());
    }

    @Test
    void logEntrySizeCountsStringsAsUtf16() {
        LogEntry entry = LogEntry.builder(LogEntryType.MESSAGE, ViewerId.DATA)
            .withTitle("abc")
            .withSessionName("s")
            .withData(new byte[10])
            .withTimestamp(Instant.EPOCH)
            .build();

        assertEquals(48 + 6 + 2 + 10, entry.size());
    }

    @Test
    void logEntryDataIsCopied() {
        byte[] data = { 1, 2, 3 };
        LogEntry entry = LogEntry.builder(LogEntryType.MESSAGE, ViewerId.DATA)
            .withData(data)
            .withTimestamp(Instant.EPOCH)
            .build();

        data[0] = 9;
        entry.data()[1] = 9;

        assertArrayEquals(new byte[] { 1, 2, 3 }, entry.data());
    }

    @Test
    void builderDefaultsToTheCallingThreadAndProcess() {
        LogEntry entry = LogEntry.builder(LogEntryType.MESSAGE, ViewerId.TITLE)
            .withTimestamp(Instant.EPOCH)
            .build();

        assertEquals((int) Thread.currentThread().getId(), entry.threadId());
        assertEquals((int) ProcessHandle.current().pid(), entry.processId());
        assertEquals(Packets.currentThreadId(), entry.threadId());
    }

    @Test
    void controlCommandIsAControlPacket() {
        ControlCommand command = new ControlCommand(ControlCommandType.CLEAR_ALL);

        assertEquals(Level.CONTROL, command.level());
        assertEquals(8, command.size());
        assertEquals(3, ControlCommandType.CLEAR_ALL.id());
    }
}
