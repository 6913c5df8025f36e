package com.questrail.tracewire.protocol;

import java.util.Objects;

/**
 * Failure of a protocol operation (connect, write, disconnect, dispatch).
 *
 * <p>Carries the protocol name and its effective options rendered as an
 * option string, so a report identifies the failing connection.</p>
 */
public class ProtocolException extends RuntimeException {
    private final String protocolName;
    private final String protocolOptions;

    public ProtocolException(String message, String protocolName, String protocolOptions, Throwable cause) {
        super(message, cause);
        this.protocolName = Objects.requireNonNull(protocolName, "protocolName");
        this.protocolOptions = Objects.requireNonNull(protocolOptions, "protocolOptions");
    }

    public ProtocolException(String message, String protocolName, String protocolOptions) {
        this(message, protocolName, protocolOptions, null);
    }

    public String protocolName() {
        return protocolName;
    }

    public String protocolOptions() {
        return protocolOptions;
    }
}
