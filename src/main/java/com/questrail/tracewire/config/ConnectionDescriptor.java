package com.questrail.tracewire.config;

import java.util.Objects;

/**
 * One protocol section of a connections string: the protocol name and its
 * option text, verbatim (quotes and escapes intact).
 */
public record ConnectionDescriptor(String protocolName, String rawOptions) {
    public ConnectionDescriptor {
        Objects.requireNonNull(protocolName, "protocolName");
        Objects.requireNonNull(rawOptions, "rawOptions");
    }
}
