package com.questrail.tracewire.transport.file;

import com.questrail.tracewire.codec.impl.BinaryPacketReader;
import com.questrail.tracewire.config.ConfigurationException;
import com.questrail.tracewire.config.ProtocolOptions;
import com.questrail.tracewire.internal.time.ManualMonotonicClock;
import com.questrail.tracewire.internal.time.ManualWallClock;
import com.questrail.tracewire.packet.LogEntry;
import com.questrail.tracewire.packet.LogEntryType;
import com.questrail.tracewire.packet.Packet;
import com.questrail.tracewire.packet.ViewerId;
import com.questrail.tracewire.protocol.ProtocolException;
import com.questrail.tracewire.protocol.ProtocolState;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.crypto.Cipher;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * FileProtocolTest
 * -----------------------------------------------------------------------------
 * File transport against a temporary directory. Time is driven through a
 * manual wall clock, so rotated file names are predictable.
 */
final class FileProtocolTest {

    private static final String KEY = "0123456789abcdef";

    @TempDir
    Path dir;

    private final ManualMonotonicClock monotonicClock = new ManualMonotonicClock();
    private final ManualWallClock wallClock = ManualWallClock.at("2024-01-01T23:59:00Z");

    private FileProtocol protocol(ProtocolOptions.Builder options) {
        FileProtocol protocol = new FileProtocol(monotonicClock, wallClock);
        protocol.loadOptions(options.build());
        return protocol;
    }

    private ProtocolOptions.Builder options() {
        return ProtocolOptions.builder().with("filename", dir.resolve("log.sil").toString());
    }

    private LogEntry entry(String title) {
        return entry(title, 0);
    }

    private LogEntry entry(String title, int dataSize) {
        return LogEntry.builder(LogEntryType.MESSAGE, ViewerId.TITLE)
            .withTitle(title)
            .withData(new byte[dataSize])
            .withTimestamp(wallClock.now())
            .build();
    }

    private static List<Packet> read(Path file) throws IOException {
        BinaryPacketReader reader = new BinaryPacketReader(new ByteArrayInputStream(Files.readAllBytes(file)));
        assertEquals("SILF", reader.readStreamHeader());
        return reader.readAll();
    }

    private static List<String> titles(List<Packet> packets) {
        return packets.stream().map(p -> ((LogEntry) p).title()).collect(Collectors.toList());
    }

    private List<Path> files() throws IOException {
        try (Stream<Path> s = Files.list(dir)) {
            return s.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
        }
    }

    @Test
    void freshFileStartsWithSilfAndHoldsThePackets() throws IOException {
        FileProtocol protocol = protocol(options());

        protocol.connect();
        protocol.writePacket(entry("one"));
        protocol.writePacket(entry("two"));
        protocol.disconnect();

        Path file = dir.resolve("log.sil");
        assertEquals(List.of("one", "two"), titles(read(file)));
    }

    @Test
    void appendDoesNotRepeatTheHeader() throws IOException {
        FileProtocol first = protocol(options());
        first.connect();
        first.writePacket(entry("one"));
        first.disconnect();

        FileProtocol second = protocol(options().with("append", true));
        second.connect();
        second.writePacket(entry("two"));
        second.disconnect();

        assertEquals(List.of("one", "two"), titles(read(dir.resolve("log.sil"))));
    }

    @Test
    void withoutAppendTheFileIsReplaced() throws IOException {
        FileProtocol first = protocol(options());
        first.connect();
        first.writePacket(entry("one"));
        first.disconnect();

        FileProtocol second = protocol(options());
        second.connect();
        second.writePacket(entry("two"));
        second.disconnect();

        assertEquals(List.of("two"), titles(read(dir.resolve("log.sil"))));
    }

    @Test
    void dailyBoundaryStartsASecondFile() throws IOException {
        FileProtocol protocol = protocol(options().with("rotate", "daily"));

        protocol.connect();
        protocol.writePacket(entry("before midnight"));
        wallClock.advance(Duration.ofSeconds(90));
        protocol.writePacket(entry("after midnight"));
        protocol.disconnect();

        List<Path> files = files();
        assertEquals(2, files.size());
        assertEquals("log-2024-01-01-23-59-00.sil", files.get(0).getFileName().toString());
        assertEquals("log-2024-01-02-00-00-30.sil", files.get(1).getFileName().toString());
        assertEquals(List.of("before midnight"), titles(read(files.get(0))));
        assertEquals(List.of("after midnight"), titles(read(files.get(1))));
    }

    @Test
    void maxPartsKeepsTheMostRecentFiles() throws IOException {
        wallClock.set(java.time.Instant.parse("2024-01-01T00:00:00Z"));
        FileProtocol protocol = protocol(options().with("rotate", "hourly").with("maxparts", 3));

        protocol.connect();
        protocol.writePacket(entry("h0"));
        for (int i = 1; i <= 5; i++) {
            wallClock.advance(Duration.ofHours(1));
            protocol.writePacket(entry("h" + i));
        }
        protocol.disconnect();

        List<Path> files = files();
        assertEquals(3, files.size());
        assertEquals("log-2024-01-01-03-00-00.sil", files.get(0).getFileName().toString());
        assertEquals("log-2024-01-01-05-00-00.sil", files.get(2).getFileName().toString());
        assertEquals(List.of("h5"), titles(read(files.get(2))));
    }

    @Test
    void maxPartsMatchesGlobCharactersInTheFileNameLiterally() throws IOException {
        for (String name : List.of("app[1].sil", "app{x.sil")) {
            wallClock.set(java.time.Instant.parse("2024-01-01T00:00:00Z"));
            Path sub = Files.createDirectory(dir.resolve(name.startsWith("app[") ? "brackets" : "brace"));
            Files.createFile(sub.resolve("app1-2024-01-01-00-00-00.sil"));
            FileProtocol protocol = protocol(ProtocolOptions.builder()
                .with("filename", sub.resolve(name).toString())
                .with("rotate", "hourly")
                .with("maxparts", 2));

            protocol.connect();
            protocol.writePacket(entry("h0"));
            for (int i = 1; i <= 4; i++) {
                wallClock.advance(Duration.ofHours(1));
                protocol.writePacket(entry("h" + i));
            }
            protocol.disconnect();

            String base = name.substring(0, name.length() - ".sil".length());
            try (Stream<Path> s = Files.list(sub)) {
                List<String> names = s.map(p -> p.getFileName().toString()).sorted().collect(Collectors.toList());
                assertEquals(List.of(
                    "app1-2024-01-01-00-00-00.sil",
                    base + "-2024-01-01-03-00-00.sil",
                    base + "-2024-01-01-04-00-00.sil"), names);
            }
        }
    }

    @Test
    void maxSizeRotatesToASuffixedName() throws IOException {
        FileProtocol protocol = protocol(options().with("maxsize", 1));
        assertEquals(2, protocol.maxParts());

        protocol.connect();
        protocol.writePacket(entry("a", 400));
        protocol.writePacket(entry("b", 400));
        protocol.writePacket(entry("c", 400));
        protocol.disconnect();

        List<Path> files = files();
        assertEquals(2, files.size());
        assertEquals("log-2024-01-01-23-59-00.sil", files.get(0).getFileName().toString());
        assertEquals("log-2024-01-01-23-59-00a.sil", files.get(1).getFileName().toString());
        assertEquals(List.of("a", "b"), titles(read(files.get(0))));
        assertEquals(List.of("c"), titles(read(files.get(1))));
    }

    @Test
    void packetLargerThanMaxSizeIsDropped() throws IOException {
        FileProtocol protocol = protocol(options().with("maxsize", 1).with("maxparts", 0));

        protocol.connect();
        protocol.writePacket(entry("huge", 2000));
        protocol.disconnect();

        for (Path file : files()) {
            assertTrue(read(file).isEmpty(), file.toString());
        }
    }

    @Test
    void encryptedFileCarriesIvAndDecryptsToPlainStream() throws Exception {
        FileProtocol protocol = protocol(options().with("encrypt", true).with("key", KEY).with("append", true));
        assertFalse(protocol.isAppend());

        protocol.connect();
        protocol.writePacket(entry("secret one"));
        protocol.writePacket(entry("secret two"));
        protocol.disconnect();

        byte[] bytes = Files.readAllBytes(dir.resolve("log.sil"));
        assertEquals("SILE", new String(bytes, 0, 4, StandardCharsets.US_ASCII));
        byte[] iv = Arrays.copyOfRange(bytes, 4, 20);
        assertArrayEquals(FileProtocol.initializationVector(wallClock.now()), iv);

        Cipher cipher = Cipher.getInstance("AES/CBC/PKCS5Padding");
        cipher.init(Cipher.DECRYPT_MODE,
            new SecretKeySpec(KEY.getBytes(StandardCharsets.US_ASCII), "AES"), new IvParameterSpec(iv));
        byte[] plain = cipher.doFinal(bytes, 20, bytes.length - 20);

        BinaryPacketReader reader = new BinaryPacketReader(new ByteArrayInputStream(plain));
        assertEquals("SILF", reader.readStreamHeader());
        assertEquals(List.of("secret one", "secret two"), titles(reader.readAll()));
    }

    @Test
    void encryptionWithoutKeyFailsBeforeOpening() throws IOException {
        FileProtocol protocol = protocol(options().with("encrypt", true));

        ProtocolException e = assertThrows(ProtocolException.class, protocol::connect);

        assertInstanceOf(ConfigurationException.class, e.getCause());
        assertEquals(ProtocolState.DISCONNECTED, protocol.state());
        assertTrue(files().isEmpty());
    }

    @Test
    void encryptionKeyMustBeSixteenBytes() {
        FileProtocol protocol = protocol(options().with("encrypt", true).with("key", "short"));

        ProtocolException e = assertThrows(ProtocolException.class, protocol::connect);

        assertTrue(e.getMessage().contains("Invalid encryption key size"));
        assertFalse(protocol.isConnected());
    }

    @Test
    void placeholdersAndMissingDirectoriesAreResolved() throws IOException {
        FileProtocol protocol = new FileProtocol(monotonicClock, wallClock);
        protocol.setAppName("billing");
        protocol.setHostName("node-7");
        protocol.loadOptions(ProtocolOptions.builder()
            .with("filename", dir.resolve("%machinename%").resolve("%appname%.sil").toString())
            .build());

        protocol.connect();
        protocol.writePacket(entry("x"));
        protocol.disconnect();

        assertEquals(List.of("x"), titles(read(dir.resolve("node-7").resolve("billing.sil"))));
    }

    @Test
    void fileSpecificOptionsAreAccepted() {
        FileProtocol protocol = new FileProtocol(monotonicClock, wallClock);

        assertTrue(protocol.isValidOption("maxparts"));
        assertTrue(protocol.isValidOption("Rotate"));
        assertTrue(protocol.isValidOption("async.enabled"));
        assertFalse(protocol.isValidOption("host"));
    }
}
