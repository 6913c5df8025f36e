package com.questrail.tracewire.transport.tcp;

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
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * TcpProtocol
 * =============================================================================
 * Sends packets to a console over TCP.
 *
 * <h2>Session</h2>
 * <ol>
 *   <li>connect within {@code timeout} milliseconds</li>
 *   <li>read the server banner line and report it as an info event</li>
 *   <li>send the client banner line</li>
 *   <li>send a log header packet</li>
 * </ol>
 * Each packet write is acknowledged by the console with two bytes; a missing
 * acknowledgement fails the write.
 *
 * <h2>Options</h2>
 * {@code host} (localhost), {@code port} (4228), {@code timeout} (30000 ms).
 */
public class TcpProtocol extends Protocol {

    static final String DEFAULT_HOST = "localhost";
    static final int DEFAULT_PORT = 4228;
    static final int DEFAULT_TIMEOUT = 30000;
    static final int ANSWER_SIZE = 2;

    private static final Set<String> OPTIONS = Set.of("host", "port", "timeout");

    private final TcpEndpointFactory endpointFactory;
    private final BinaryPacketFormatter formatter = new BinaryPacketFormatter();
    private final ReusableBuffer packetBuffer = new ReusableBuffer();

    private String host = DEFAULT_HOST;
    private int port = DEFAULT_PORT;
    private int timeout = DEFAULT_TIMEOUT;

    private StreamEndpoint endpoint;

    public TcpProtocol(TcpEndpointFactory endpointFactory, MonotonicClock monotonicClock, WallClock wallClock) {
        super(monotonicClock, wallClock);
        this.endpointFactory = Objects.requireNonNull(endpointFactory, "endpointFactory");
    }

    public TcpProtocol() {
        this(TcpEndpointFactory.NETTY, SystemMonotonicClock.INSTANCE, SystemWallClock.INSTANCE);
    }

    @Override
    public String name() {
        return "tcp";
    }

    @Override
    public boolean isValidOption(String name) {
        return OPTIONS.contains(name.toLowerCase(Locale.ROOT)) || super.isValidOption(name);
    }

    @Override
    protected void applyOptions(ProtocolOptions options) {
        super.applyOptions(options);
        host = options.getString("host", DEFAULT_HOST);
        port = options.getInteger("port", DEFAULT_PORT);
        timeout = options.getInteger("timeout", DEFAULT_TIMEOUT);
    }

    @Override
    protected void buildOptions(ConnectionsBuilder builder) {
        super.buildOptions(builder);
        builder.addOption("host", host);
        builder.addOption("port", port);
        builder.addOption("timeout", timeout);
    }

    @Override
    protected void internalConnect() throws IOException {
        endpoint = endpointFactory.open(host, port, timeout);
        String banner = Handshake.readLine(endpoint);
        fireInfo("Console server banner: \"" + banner + "\"");
        endpoint.write(Handshake.clientBanner(name()));
        writeLogHeader();
    }

    @Override
    protected void internalWritePacket(Packet packet) throws IOException {
        StreamEndpoint ep = endpoint;
        if (ep == null || !ep.isOpen()) {
            throw new IOException("Connection stream is no longer writable; the connection no longer exists");
        }
        packetBuffer.reset();
        formatter.format(packet, packetBuffer);
        ep.write(packetBuffer.array(), 0, packetBuffer.size());
        Handshake.readExactly(ep, ANSWER_SIZE);
    }

    @Override
    protected void internalDisconnect() throws IOException {
        StreamEndpoint ep = endpoint;
        endpoint = null;
        if (ep != null) {
            ep.close();
        }
    }

    public String host() {
        return host;
    }

    public int port() {
        return port;
    }

    public int timeout() {
        return timeout;
    }
}
