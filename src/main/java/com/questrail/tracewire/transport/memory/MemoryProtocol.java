package com.questrail.tracewire.transport.memory;

import com.questrail.tracewire.codec.PacketFormatter;
import com.questrail.tracewire.codec.StreamHeaders;
import com.questrail.tracewire.codec.impl.BinaryPacketFormatter;
import com.questrail.tracewire.codec.text.TextPacketFormatter;
import com.questrail.tracewire.config.ConnectionsBuilder;
import com.questrail.tracewire.config.ProtocolOptions;
import com.questrail.tracewire.internal.time.MonotonicClock;
import com.questrail.tracewire.internal.time.SystemMonotonicClock;
import com.questrail.tracewire.internal.time.SystemWallClock;
import com.questrail.tracewire.internal.time.WallClock;
import com.questrail.tracewire.packet.Packet;
import com.questrail.tracewire.protocol.PacketQueue;
import com.questrail.tracewire.protocol.Protocol;
import com.questrail.tracewire.protocol.ProtocolCommand;

import java.io.IOException;
import java.io.OutputStream;
import java.time.ZoneId;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * MemoryProtocol
 * =============================================================================
 * Keeps the most recent packets in a bounded in-memory queue until they are
 * dispatched somewhere else.
 *
 * <h2>Dispatch</h2>
 * {@link #dispatch(ProtocolCommand)} drains the queue, oldest first, into
 * the command's state:
 * <ul>
 *   <li>a {@link Protocol}: each packet is passed to its
 *       {@link Protocol#writePacket(Packet)};</li>
 *   <li>an {@link OutputStream}: the stream header ({@code SILF}, or a byte
 *       order mark with {@code astext}) followed by the formatted packets.</li>
 * </ul>
 * Any other state fails with {@link IllegalArgumentException}. The action
 * code is ignored.
 *
 * <h2>Options</h2>
 * {@code maxsize} (KB, 8192), {@code astext}, {@code pattern},
 * {@code indent}.
 */
public class MemoryProtocol extends Protocol {

    static final long DEFAULT_MAX_SIZE_KB = 8192;

    private static final Set<String> OPTIONS = Set.of("maxsize", "astext", "pattern", "indent");

    private final ZoneId zone;

    private long maxSize = DEFAULT_MAX_SIZE_KB * 1024;
    private boolean asText;
    private String pattern = TextPacketFormatter.DEFAULT_PATTERN;
    private boolean indent;

    private volatile PacketQueue queue;

    public MemoryProtocol(MonotonicClock monotonicClock, WallClock wallClock, ZoneId zone) {
        super(monotonicClock, wallClock);
        this.zone = Objects.requireNonNull(zone, "zone");
    }

    public MemoryProtocol() {
        this(SystemMonotonicClock.INSTANCE, SystemWallClock.INSTANCE, ZoneId.systemDefault());
    }

    @Override
    public String name() {
        return "mem";
    }

    @Override
    public boolean isValidOption(String name) {
        return OPTIONS.contains(name.toLowerCase(Locale.ROOT)) || super.isValidOption(name);
    }

    @Override
    protected void applyOptions(ProtocolOptions options) {
        super.applyOptions(options);
        maxSize = options.getSizeBytes("maxsize", DEFAULT_MAX_SIZE_KB);
        asText = options.getBoolean("astext", false);
        pattern = options.getString("pattern", TextPacketFormatter.DEFAULT_PATTERN);
        indent = options.getBoolean("indent", false);
    }

    @Override
    protected void buildOptions(ConnectionsBuilder builder) {
        super.buildOptions(builder);
        builder.addOption("maxsize", maxSize / 1024);
        builder.addOption("astext", asText);
        builder.addOption("indent", indent);
        builder.addOption("pattern", pattern);
    }

    @Override
    protected void internalConnect() {
        queue = new PacketQueue(maxSize);
    }

    @Override
    protected void internalWritePacket(Packet packet) {
        queue.push(packet);
    }

    @Override
    protected void internalDisconnect() {
        if (queue != null) {
            queue.clear();
            queue = null;
        }
    }

    @Override
    protected void internalDispatch(ProtocolCommand command) throws IOException {
        Object state = command.state();
        if (state instanceof Protocol target) {
            flushTo(target);
        } else if (state instanceof OutputStream out) {
            flushTo(out);
        } else {
            throw new IllegalArgumentException("Unsupported dispatch target: "
                + (state == null ? "null" : state.getClass().getName()));
        }
    }

    private void flushTo(Protocol target) {
        Packet packet;
        while ((packet = queue.pop()) != null) {
            target.writePacket(packet);
        }
    }

    private void flushTo(OutputStream out) throws IOException {
        PacketFormatter formatter = asText
            ? new TextPacketFormatter(pattern, indent, zone)
            : new BinaryPacketFormatter();
        out.write(asText ? StreamHeaders.utf8Bom() : StreamHeaders.silf());
        Packet packet;
        while ((packet = queue.pop()) != null) {
            formatter.format(packet, out);
        }
        out.flush();
    }

    /** Packets currently held; empty when disconnected. */
    public List<Packet> snapshot() {
        PacketQueue q = queue;
        return q == null ? List.of() : q.snapshot();
    }

    public long maxSize() {
        return maxSize;
    }

    public boolean isAsText() {
        return asText;
    }
}
