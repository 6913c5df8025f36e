package com.questrail.tracewire.transport.tcp.netty;

import com.questrail.tracewire.transport.StreamEndpoint;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioSocketChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * NettyTcpStreamEndpoint
 * =============================================================================
 * Netty-backed implementation of the {@link StreamEndpoint} port.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>. It does not know
 * about banners, packets or acknowledgements.
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package.
 *
 * <p>Inbound bytes are copied into {@code byte[]} chunks on the event loop
 * and handed to the blocking {@link #read} caller through a queue. All
 * reference-counted buffers are released internally.</p>
 *
 * <h2>Lifecycle</h2>
 * - {@link #connect(String, int, int)} opens the socket, waiting at most the
 *   timeout; the same timeout bounds every blocking read.
 * - {@link #close()} closes the channel and shuts down the event loop group.
 */
public final class NettyTcpStreamEndpoint implements StreamEndpoint
{
    private static final Logger log = LoggerFactory.getLogger(NettyTcpStreamEndpoint.class);

    private static final byte[] END_OF_STREAM = new byte[0];

    private final EventLoopGroup group;
    private final int timeoutMillis;
    private final BlockingQueue<byte[]> inbound = new LinkedBlockingQueue<>();

    private volatile Channel channel;
    private byte[] current;
    private int currentPos;
    private boolean endOfStream;

    private NettyTcpStreamEndpoint(int timeoutMillis)
    {
        this.group = new NioEventLoopGroup(1);
        this.timeoutMillis = timeoutMillis;
    }

    /**
     * Opens a connection to {@code host:port}.
     *
     * @throws IOException if the connection cannot be established within
     *         {@code timeoutMillis}
     */
    public static NettyTcpStreamEndpoint connect(String host, int port, int timeoutMillis) throws IOException
    {
        Objects.requireNonNull(host, "host");
        NettyTcpStreamEndpoint endpoint = new NettyTcpStreamEndpoint(timeoutMillis);
        endpoint.open(host, port);
        return endpoint;
    }

    private void open(String host, int port) throws IOException
    {
        Bootstrap bootstrap = new Bootstrap();
        bootstrap.group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, timeoutMillis)
                .option(ChannelOption.TCP_NODELAY, true)
                .handler(new ChannelInitializer<NioSocketChannel>() {
                    @Override
                    protected void initChannel(NioSocketChannel ch)
                    {
                        ch.pipeline().addLast(new InboundHandler());
                    }
                });

        ChannelFuture f = bootstrap.connect(host, port);
        f.awaitUninterruptibly();
        if (!f.isSuccess()) {
            group.shutdownGracefully(0, 1, TimeUnit.SECONDS);
            ConnectException e = new ConnectException("Could not connect to " + host + ":" + port);
            e.initCause(f.cause());
            throw e;
        }
        channel = f.channel();
    }

    @Override
    public void write(byte[] bytes, int offset, int length) throws IOException
    {
        Channel ch = channel;
        if (ch == null || !ch.isActive()) {
            throw new IOException("Connection is closed");
        }

        ByteBuf buf = Unpooled.copiedBuffer(bytes, offset, length);
        ChannelFuture f = ch.writeAndFlush(buf);
        f.awaitUninterruptibly();
        if (!f.isSuccess()) {
            throw new IOException("Write failed", f.cause());
        }
    }

    @Override
    public int read(byte[] buffer, int offset, int length) throws IOException
    {
        if (length == 0) {
            return 0;
        }
        if (current == null || currentPos >= current.length) {
            if (endOfStream) {
                return -1;
            }
            byte[] next;
            try {
                next = inbound.poll(timeoutMillis, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("Interrupted while reading", e);
            }
            if (next == null) {
                throw new SocketTimeoutException("Read timed out after " + timeoutMillis + " ms");
            }
            if (next == END_OF_STREAM) {
                endOfStream = true;
                return -1;
            }
            current = next;
            currentPos = 0;
        }

        int n = Math.min(length, current.length - currentPos);
        System.arraycopy(current, currentPos, buffer, offset, n);
        currentPos += n;
        return n;
    }

    @Override
    public boolean isOpen()
    {
        Channel ch = channel;
        return ch != null && ch.isActive();
    }

    @Override
    public void close()
    {
        Channel ch = channel;
        if (ch != null) {
            ch.close().awaitUninterruptibly();
        }
        group.shutdownGracefully(0, 1, TimeUnit.SECONDS);
    }

    /**
     * InboundHandler
     * -------------------------------------------------------------------------
     * Copies received bytes into the read queue and marks the end of stream
     * when the channel goes inactive.
     */
    private final class InboundHandler extends SimpleChannelInboundHandler<ByteBuf>
    {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, ByteBuf msg)
        {
            // Copy into a plain byte[] (Netty containment rule).
            byte[] bytes = new byte[msg.readableBytes()];
            msg.getBytes(msg.readerIndex(), bytes);
            if (bytes.length > 0) {
                inbound.offer(bytes);
            }
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            inbound.offer(END_OF_STREAM);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            log.debug("Closing console connection after channel failure", cause);
            ctx.close();
        }
    }
}
