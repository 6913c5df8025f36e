package com.questrail.tracewire.transport.file;

import com.questrail.tracewire.codec.PacketFormatter;
import com.questrail.tracewire.codec.StreamHeaders;
import com.questrail.tracewire.codec.impl.BinaryPacketFormatter;
import com.questrail.tracewire.config.ConfigurationException;
import com.questrail.tracewire.config.ConnectionsBuilder;
import com.questrail.tracewire.config.ProtocolOptions;
import com.questrail.tracewire.internal.time.MonotonicClock;
import com.questrail.tracewire.internal.time.SystemMonotonicClock;
import com.questrail.tracewire.internal.time.SystemWallClock;
import com.questrail.tracewire.internal.time.WallClock;
import com.questrail.tracewire.packet.Packet;
import com.questrail.tracewire.protocol.Protocol;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Instant;
import java.util.Locale;
import java.util.Set;

/**
 * FileProtocol
 * =============================================================================
 * Writes packets to a local log file in the binary format.
 *
 * <h2>Stream layout</h2>
 * A fresh file starts with {@code SILF}. An encrypted file starts with
 * {@code SILE} and a 16 byte IV in clear, followed by the AES-128/CBC
 * encryption of {@code SILF} and the packets. Appending to a non-empty file
 * writes no header.
 *
 * <h2>Rotation</h2>
 * With {@code rotate} or {@code maxsize} set the file name carries the UTC
 * time it was opened ({@link RotatedFiles}). A new file is started when the
 * clock crosses the {@code rotate} boundary or the next packet would push
 * the file past {@code maxsize}; a packet larger than {@code maxsize} is
 * dropped. After each open the oldest files beyond {@code maxparts} are
 * deleted (0 keeps all).
 *
 * <h2>Options</h2>
 * {@code filename} (log.sil; {@code %appname%} and {@code %machinename%} are
 * substituted), {@code append}, {@code buffer} (KB; 0 flushes after every
 * packet), {@code rotate}, {@code maxsize} (KB), {@code maxparts},
 * {@code encrypt}, {@code key} (exactly 16 bytes).
 */
public class FileProtocol extends Protocol {

    static final int DEFAULT_BUFFER = 0x2000;
    static final int KEY_SIZE = AesCbcOutputStream.KEY_SIZE;

    // .NET ticks at the Unix epoch; seeds the IV the way consoles expect
    private static final long EPOCH_TICKS = 621_355_968_000_000_000L;

    private static final Set<String> OPTIONS = Set.of(
        "append", "buffer", "encrypt", "filename", "key", "maxsize", "maxparts", "rotate");

    private final FileRotater rotater = new FileRotater();
    private PacketFormatter formatter;

    private String fileName = defaultFileName();
    private boolean append;
    private long ioBuffer;
    private FileRotate rotate = FileRotate.NO_ROTATE;
    private long maxSize;
    private int maxParts;
    private boolean encrypt;
    private byte[] key;

    private OutputStream stream;
    private Path currentFile;
    private long fileSize;
    private long ioBufferCounter;

    public FileProtocol(MonotonicClock monotonicClock, WallClock wallClock) {
        super(monotonicClock, wallClock);
    }

    public FileProtocol() {
        this(SystemMonotonicClock.INSTANCE, SystemWallClock.INSTANCE);
    }

    @Override
    public String name() {
        return "file";
    }

    protected String defaultFileName() {
        return "log.sil";
    }

    /**
     * Formatter for packets; recreated whenever options are applied.
     */
    protected PacketFormatter createFormatter() {
        return new BinaryPacketFormatter();
    }

    /**
     * Eye-catcher written at the start of a fresh file.
     */
    protected byte[] streamHeader() {
        return StreamHeaders.silf();
    }

    /**
     * Written before a file is closed; nothing by default.
     */
    protected void writeFooter(OutputStream out) throws IOException {
    }

    @Override
    public boolean isValidOption(String name) {
        return OPTIONS.contains(name.toLowerCase(Locale.ROOT)) || super.isValidOption(name);
    }

    @Override
    protected void applyOptions(ProtocolOptions options) {
        super.applyOptions(options);
        fileName = options.getString("filename", defaultFileName());
        append = options.getBoolean("append", false);
        ioBuffer = options.getSizeBytes("buffer", 0);
        rotate = FileRotate.parse(options.getString("rotate", null), FileRotate.NO_ROTATE);
        maxSize = options.getSizeBytes("maxsize", 0);
        maxParts = options.getInteger("maxparts", maxSize > 0 ? 2 : 0);
        encrypt = options.getBoolean("encrypt", false);
        byte[] k = options.getBytes("key");
        key = k != null && k.length > 0 ? k : null;
        if (encrypt) {
            append = false;
        }
        rotater.setMode(rotate);
        formatter = createFormatter();
    }

    @Override
    protected void buildOptions(ConnectionsBuilder builder) {
        super.buildOptions(builder);
        builder.addOption("append", append);
        builder.addOption("buffer", ioBuffer / 1024);
        builder.addOption("filename", fileName);
        builder.addOption("maxsize", maxSize / 1024);
        builder.addOption("maxparts", maxParts);
        builder.addOption("rotate", rotate.label());
    }

    @Override
    protected void validateOptions() {
        if (encrypt) {
            if (key == null) {
                throw new ConfigurationException("No encryption key");
            }
            if (key.length != KEY_SIZE) {
                throw new ConfigurationException(
                    "Invalid encryption key size: expected " + KEY_SIZE + " bytes, got " + key.length);
            }
        }
    }

    @Override
    protected void internalConnect() throws IOException {
        if (formatter == null) {
            formatter = createFormatter();
        }
        open(append);
    }

    @Override
    protected void internalWritePacket(Packet packet) throws IOException {
        int packetSize = formatter.compile(packet);

        if (rotate != FileRotate.NO_ROTATE && rotater.update(wallClock.now())) {
            rotateFile();
        }

        if (maxSize > 0) {
            fileSize += packetSize;
            if (fileSize > maxSize) {
                rotateFile();
                if (packetSize > maxSize) {
                    return;
                }
                fileSize += packetSize;
            }
        }

        formatter.write(stream);

        if (ioBuffer > 0) {
            ioBufferCounter += packetSize;
            if (ioBufferCounter > ioBuffer) {
                ioBufferCounter = 0;
                stream.flush();
            }
        } else {
            stream.flush();
        }
    }

    @Override
    protected void internalDisconnect() throws IOException {
        OutputStream s = stream;
        stream = null;
        if (s != null) {
            try {
                writeFooter(s);
            } finally {
                s.close();
            }
        }
    }

    /** File currently written, or {@code null} when closed. */
    public Path currentFile() {
        return currentFile;
    }

    public String fileName() {
        return fileName;
    }

    public FileRotate rotate() {
        return rotate;
    }

    public long maxSize() {
        return maxSize;
    }

    public int maxParts() {
        return maxParts;
    }

    public boolean isEncrypted() {
        return encrypt;
    }

    public boolean isAppend() {
        return append;
    }

    private boolean isRotating() {
        return rotate != FileRotate.NO_ROTATE || maxSize > 0;
    }

    private void rotateFile() throws IOException {
        internalDisconnect();
        open(false);
    }

    private void open(boolean appendMode) throws IOException {
        Path base = Paths.get(fileName
            .replace("%appname%", appName())
            .replace("%machinename%", hostName()));

        Path parent = base.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        Instant now = wallClock.now();
        Path file = isRotating() ? RotatedFiles.fileName(base, appendMode, now) : base;

        OutputStream out;
        try {
            out = appendMode
                ? Files.newOutputStream(file, StandardOpenOption.CREATE, StandardOpenOption.APPEND)
                : Files.newOutputStream(file, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING,
                    StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new IOException("Could not open log file \"" + file
                + "\"; check that the name is valid and the file is not locked by another application", e);
        }

        try {
            long size = appendMode ? Files.size(file) : 0;
            if (encrypt) {
                out = openCipher(out, now);
            }
            size = writeHeader(out, size);
            stream = new BufferedOutputStream(out, ioBuffer > 0 ? (int) Math.min(ioBuffer, Integer.MAX_VALUE) : DEFAULT_BUFFER);
            fileSize = size;
            ioBufferCounter = 0;
            currentFile = file;
        } catch (IOException | RuntimeException e) {
            out.close();
            throw e;
        }

        afterOpen(base, file, now);
    }

    private OutputStream openCipher(OutputStream out, Instant now) throws IOException {
        byte[] iv = initializationVector(now);
        out.write(StreamHeaders.sile());
        out.write(iv);
        out.flush();
        try {
            return new AesCbcOutputStream(out, key, iv);
        } catch (GeneralSecurityException e) {
            throw new IOException("Could not initialize AES cipher", e);
        }
    }

    private long writeHeader(OutputStream out, long size) throws IOException {
        if (size != 0) {
            return size;
        }
        byte[] header = streamHeader();
        out.write(header);
        out.flush();
        return header.length;
    }

    private void afterOpen(Path base, Path file, Instant now) throws IOException {
        if (!isRotating()) {
            return;
        }
        if (rotate != FileRotate.NO_ROTATE) {
            rotater.initialize(RotatedFiles.fileDate(base, file).orElse(now));
        }
        if (maxParts == 0) {
            return;
        }
        RotatedFiles.deleteOldest(base, maxParts);
    }

    static byte[] initializationVector(Instant now) {
        long ticks = EPOCH_TICKS + now.getEpochSecond() * 10_000_000L + now.getNano() / 100;
        try {
            return MessageDigest.getInstance("MD5").digest(Long.toString(ticks).getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }
}
