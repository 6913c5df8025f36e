package com.questrail.tracewire.transport.file;

import com.questrail.tracewire.config.ConfigurationException;
import com.questrail.tracewire.config.ProtocolOptions;
import com.questrail.tracewire.internal.time.ManualMonotonicClock;
import com.questrail.tracewire.internal.time.ManualWallClock;
import com.questrail.tracewire.packet.Level;
import com.questrail.tracewire.packet.LogEntry;
import com.questrail.tracewire.packet.LogEntryType;
import com.questrail.tracewire.packet.ViewerId;
import com.questrail.tracewire.packet.Watch;
import com.questrail.tracewire.packet.WatchType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneOffset;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

final class TextProtocolTest {

    @TempDir
    Path dir;

    private final ManualWallClock wallClock = ManualWallClock.at("2024-05-06T07:08:09Z");

    private TextProtocol protocol(ProtocolOptions options) {
        TextProtocol protocol = new TextProtocol(new ManualMonotonicClock(), wallClock, ZoneOffset.UTC);
        protocol.loadOptions(options);
        return protocol;
    }

    private LogEntry entry(LogEntryType type, String title) {
        return LogEntry.builder(type, ViewerId.TITLE)
            .withLevel(Level.MESSAGE)
            .withTitle(title)
            .withTimestamp(wallClock.now())
            .build();
    }

    @Test
    void writesBomAndOneLinePerLogEntry() throws Exception {
        Path file = dir.resolve("log.txt");
        TextProtocol protocol = protocol(ProtocolOptions.builder()
            .with("filename", file.toString())
            .with("pattern", "%timestamp{HH:mm:ss}% %level%: %title%")
            .with("indent", true)
            .build());

        protocol.connect();
        protocol.writePacket(entry(LogEntryType.ENTER_METHOD, "Run"));
        protocol.writePacket(Watch.of("ignored", "1", WatchType.INTEGER, wallClock.now()));
        protocol.writePacket(entry(LogEntryType.MESSAGE, "inside"));
        protocol.writePacket(entry(LogEntryType.LEAVE_METHOD, "Run"));
        protocol.disconnect();

        byte[] bytes = Files.readAllBytes(file);
        assertArrayEquals(new byte[] { (byte) 0xEF, (byte) 0xBB, (byte) 0xBF }, Arrays.copyOf(bytes, 3));
        String text = new String(bytes, 3, bytes.length - 3, StandardCharsets.UTF_8);
        assertEquals("07:08:09 Message: Run\r\n"
            + "07:08:09 Message:    inside\r\n"
            + "07:08:09 Message: Run\r\n", text);
    }

    @Test
    void defaultsToLogTxt() {
        TextProtocol protocol = protocol(ProtocolOptions.empty());

        assertEquals("log.txt", protocol.fileName());
        assertEquals("text", protocol.name());
    }

    @Test
    void encryptionIsNotAvailable() {
        TextProtocol protocol = new TextProtocol();

        assertFalse(protocol.isValidOption("encrypt"));
        assertFalse(protocol.isValidOption("key"));
        assertTrue(protocol.isValidOption("pattern"));
        assertTrue(protocol.isValidOption("rotate"));
        assertThrows(ConfigurationException.class, () -> protocol.initialize("encrypt=true"));
    }
}
