package com.questrail.tracewire.codec;

/**
 * Raised when a byte stream does not hold a well-formed packet.
 */
public class PacketDecodeException extends RuntimeException {
    public PacketDecodeException(String message) {
        super(message);
    }

    public PacketDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
