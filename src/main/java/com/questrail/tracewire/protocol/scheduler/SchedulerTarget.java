package com.questrail.tracewire.protocol.scheduler;

import com.questrail.tracewire.packet.Packet;
import com.questrail.tracewire.protocol.ProtocolCommand;

/**
 * The protocol primitives a {@link Scheduler} worker executes. Each method
 * handles its own failures; none of them throws.
 */
public interface SchedulerTarget {

    void runConnect();

    void runWritePacket(Packet packet);

    void runDisconnect();

    void runDispatch(ProtocolCommand command);

    /** Whether the last operation failed. */
    boolean isFailed();
}
