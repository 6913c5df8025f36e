package com.questrail.tracewire.transport;

import java.io.ByteArrayOutputStream;

/**
 * Byte sink whose backing array can be handed to a transport without a copy.
 */
public final class ReusableBuffer extends ByteArrayOutputStream {

    public ReusableBuffer() {
        super(8192);
    }

    public byte[] array() {
        return buf;
    }
}
