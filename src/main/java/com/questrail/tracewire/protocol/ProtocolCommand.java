package com.questrail.tracewire.protocol;

/**
 * Transport-specific side operation routed through {@link Protocol#dispatch}.
 *
 * <p>The meaning of {@code action} and {@code state} is defined by the
 * receiving protocol; the memory protocol, for example, flushes its buffer to
 * an {@link java.io.OutputStream} or another {@link Protocol} given as state.</p>
 */
public record ProtocolCommand(int action, Object state) {
}
