package com.questrail.tracewire.transport.pipe;

import com.questrail.tracewire.codec.impl.BinaryPacketFormatter;
import com.questrail.tracewire.config.ConnectionsBuilder;
import com.questrail.tracewire.config.ProtocolOptions;
import com.questrail.tracewire.internal.time.MonotonicClock;
import com.questrail.tracewire.internal.time.SystemMonotonicClock;
import com.questrail.tracewire.internal.time.SystemWallClock;
import com.questrail.tracewire.internal.time.WallClock;
import com.questrail.tracewire.packet.Packet;
import com.questrail.tracewire.protocol.Protocol;
import com.questrail.tracewire.transport.Handshake;
import com.questrail.tracewire.transport.ReusableBuffer;
import com.questrail.tracewire.transport.StreamEndpoint;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Sends packets to a console on the same machine through a named pipe.
 *
 * <p>The handshake mirrors {@code tcp}: the console's banner (a single read of
 * up to 255 bytes) is reported as an info event, then the client banner and a
 * log header are sent. Writes are not acknowledged.</p>
 *
 * <p>Option: {@code pipename} (smartinspect).</p>
 */
public class PipeProtocol extends Protocol {

    static final String DEFAULT_PIPE_NAME = "smartinspect";
    static final int BANNER_SIZE = 0xff;

    private final PipeEndpointFactory endpointFactory;
    private final BinaryPacketFormatter formatter = new BinaryPacketFormatter();
    private final ReusableBuffer packetBuffer = new ReusableBuffer();

    private String pipeName = DEFAULT_PIPE_NAME;
    private StreamEndpoint endpoint;

    public PipeProtocol(PipeEndpointFactory endpointFactory, MonotonicClock monotonicClock, WallClock wallClock) {
        super(monotonicClock, wallClock);
        this.endpointFactory = Objects.requireNonNull(endpointFactory, "endpointFactory");
    }

    public PipeProtocol() {
        this(PipeEndpointFactory.WINDOWS, SystemMonotonicClock.INSTANCE, SystemWallClock.INSTANCE);
    }

    @Override
    public String name() {
        return "pipe";
    }

    @Override
    public boolean isValidOption(String name) {
        return name.equalsIgnoreCase("pipename") || super.isValidOption(name);
    }

    @Override
    protected void applyOptions(ProtocolOptions options) {
        super.applyOptions(options);
        pipeName = options.getString("pipename", DEFAULT_PIPE_NAME);
    }

    @Override
    protected void buildOptions(ConnectionsBuilder builder) {
        super.buildOptions(builder);
        builder.addOption("pipename", pipeName);
    }

    @Override
    protected void internalConnect() throws IOException {
        endpoint = endpointFactory.open(pipeName);
        byte[] banner = new byte[BANNER_SIZE];
        int n = endpoint.read(banner, 0, banner.length);
        if (n <= 0) {
            throw new IOException("Could not read server banner correctly: connection has been closed unexpectedly");
        }
        String text = new String(banner, 0, n, StandardCharsets.UTF_8).replace("\r", "").replace("\n", "");
        fireInfo("Console server banner: \"" + text + "\"");
        endpoint.write(Handshake.clientBanner(name()));
        writeLogHeader();
    }

    @Override
    protected void internalWritePacket(Packet packet) throws IOException {
        StreamEndpoint ep = endpoint;
        if (ep == null || !ep.isOpen()) {
            throw new IOException("Pipe is no longer writable; the connection no longer exists");
        }
        packetBuffer.reset();
        formatter.format(packet, packetBuffer);
        ep.write(packetBuffer.array(), 0, packetBuffer.size());
    }

    @Override
    protected void internalDisconnect() throws IOException {
        StreamEndpoint ep = endpoint;
        endpoint = null;
        if (ep != null) {
            ep.close();
        }
    }

    public String pipeName() {
        return pipeName;
    }
}
