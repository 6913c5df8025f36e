package com.questrail.tracewire.config;

import java.util.Objects;

/**
 * A single {@code key=value} pair of a protocol option string; the value is
 * already unescaped.
 */
public record ProtocolOption(String protocol, String key, String value) {
    public ProtocolOption {
        Objects.requireNonNull(protocol, "protocol");
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
    }
}
