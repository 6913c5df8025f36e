package com.questrail.tracewire.transport;

import java.io.Closeable;
import java.io.IOException;

/**
 * StreamEndpoint
 * =============================================================================
 * Port for a bidirectional byte stream to a console: a TCP socket or a named
 * pipe.
 *
 * <h2>Architectural Role</h2>
 * The endpoint moves bytes only. Handshake, packet framing and
 * acknowledgements are the business of the protocol that owns it, which
 * keeps the transport library (Netty, file handles) behind this seam.
 *
 * <p>Calls come from one thread at a time.</p>
 */
public interface StreamEndpoint extends Closeable
{
    /**
     * Writes and flushes {@code length} bytes.
     */
    void write(byte[] bytes, int offset, int length) throws IOException;

    default void write(byte[] bytes) throws IOException {
        write(bytes, 0, bytes.length);
    }

    /**
     * Reads up to {@code length} bytes, blocking until at least one is
     * available.
     *
     * @return bytes read, or -1 at end of stream
     * @throws java.net.SocketTimeoutException if nothing arrives in time
     */
    int read(byte[] buffer, int offset, int length) throws IOException;

    boolean isOpen();
}
