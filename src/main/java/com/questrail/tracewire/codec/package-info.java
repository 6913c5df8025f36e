/**
 * Packet serialization.
 *
 * <p>A {@link com.questrail.tracewire.codec.PacketFormatter} turns one
 * {@link com.questrail.tracewire.packet.Packet} into bytes for a stream.
 * Two implementations exist:</p>
 * <ul>
 *   <li>{@code impl.BinaryPacketFormatter}: the compact binary wire format
 *       read by the console</li>
 *   <li>{@code text.TextPacketFormatter}: one human readable line per log
 *       entry</li>
 * </ul>
 *
 * <p>Formatters are stateful (compile, then write) and are not thread safe.
 * Each protocol owns its formatter and calls it under its own lock.</p>
 */
package com.questrail.tracewire.codec;
