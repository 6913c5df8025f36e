/**
 * Transport implementations of {@link com.questrail.tracewire.protocol.Protocol}.
 *
 * <p>The set of transports is closed: {@link com.questrail.tracewire.transport.ProtocolKind}
 * names each one and {@link com.questrail.tracewire.transport.ProtocolFactory}
 * creates them by the name used in a connections string.</p>
 *
 * <ul>
 *   <li>{@code tcp}: socket to a console, on Netty ({@code tcp.netty})</li>
 *   <li>{@code pipe}: Windows named pipe to a local console</li>
 *   <li>{@code file}, {@code text}: rotating log files, optionally encrypted</li>
 *   <li>{@code mem}: bounded in-memory buffer flushed on demand</li>
 * </ul>
 *
 * <p>Socket-like transports talk through the
 * {@link com.questrail.tracewire.transport.StreamEndpoint} port.</p>
 */
package com.questrail.tracewire.transport;
