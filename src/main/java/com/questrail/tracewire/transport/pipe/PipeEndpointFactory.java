package com.questrail.tracewire.transport.pipe;

import com.questrail.tracewire.transport.StreamEndpoint;

import java.io.IOException;

/**
 * Opens the named pipe a {@link PipeProtocol} talks through.
 */
@FunctionalInterface
public interface PipeEndpointFactory {

    PipeEndpointFactory WINDOWS = NamedPipeStreamEndpoint::open;

    StreamEndpoint open(String pipeName) throws IOException;
}
