package com.questrail.tracewire.codec;

import com.questrail.tracewire.packet.Packet;

import java.io.IOException;
import java.io.OutputStream;

/**
 * PacketFormatter
 * -----------------------------------------------------------------------------
 * Two-step serializer: {@link #compile(Packet)} prepares the bytes of one
 * packet and reports their exact length, {@link #write(OutputStream)} emits
 * the prepared bytes.
 *
 * <p>The split lets size-based file rotation decide where a packet goes
 * before anything is written.</p>
 */
public interface PacketFormatter
{
    /**
     * Prepares {@code packet} for writing.
     *
     * @return exact number of bytes the next {@link #write} call emits;
     *         0 if this formatter does not render the packet kind
     */
    int compile(Packet packet);

    /**
     * Writes the bytes prepared by the last {@link #compile} call.
     */
    void write(OutputStream out) throws IOException;

    /**
     * Compiles and writes in one step.
     */
    default void format(Packet packet, OutputStream out) throws IOException {
        compile(packet);
        write(out);
    }
}
