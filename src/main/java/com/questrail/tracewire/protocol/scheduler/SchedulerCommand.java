package com.questrail.tracewire.protocol.scheduler;

import com.questrail.tracewire.packet.Packet;
import com.questrail.tracewire.protocol.ProtocolCommand;

import java.util.Objects;

/**
 * Unit of work for a {@link Scheduler}.
 *
 * <p>{@code size} is the byte charge against the queue budget: the packet
 * size for {@link SchedulerAction#WRITE_PACKET}, 0 for everything else.</p>
 */
public record SchedulerCommand(SchedulerAction action, Object state, int size) {

    public SchedulerCommand {
        Objects.requireNonNull(action, "action");
        if (size < 0) {
            throw new IllegalArgumentException("size must be >= 0");
        }
    }

    public static SchedulerCommand connect() {
        return new SchedulerCommand(SchedulerAction.CONNECT, null, 0);
    }

    public static SchedulerCommand disconnect() {
        return new SchedulerCommand(SchedulerAction.DISCONNECT, null, 0);
    }

    public static SchedulerCommand writePacket(Packet packet) {
        Objects.requireNonNull(packet, "packet");
        return new SchedulerCommand(SchedulerAction.WRITE_PACKET, packet, packet.size());
    }

    public static SchedulerCommand dispatch(ProtocolCommand command) {
        return new SchedulerCommand(SchedulerAction.DISPATCH, command, 0);
    }

    public Packet packet() {
        return (Packet) state;
    }

    public ProtocolCommand protocolCommand() {
        return (ProtocolCommand) state;
    }
}
