package com.questrail.tracewire.transport.tcp;

import com.questrail.tracewire.transport.StreamEndpoint;
import com.questrail.tracewire.transport.tcp.netty.NettyTcpStreamEndpoint;

import java.io.IOException;

/**
 * Opens the socket a {@link TcpProtocol} talks through.
 */
@FunctionalInterface
public interface TcpEndpointFactory {

    TcpEndpointFactory NETTY = NettyTcpStreamEndpoint::connect;

    StreamEndpoint open(String host, int port, int timeoutMillis) throws IOException;
}
