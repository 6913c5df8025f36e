package com.questrail.tracewire.packet;

import java.util.Arrays;
import java.util.Objects;

/**
 * Console control instruction (clear log, clear watches, ...). Always
 * carries {@link Level#CONTROL}.
 */
public record ControlCommand(
    ControlCommandType controlCommandType,
    byte[] data
) implements Packet {

    static final int HEADER_SIZE = 8;

    public ControlCommand {
        Objects.requireNonNull(controlCommandType, "controlCommandType");
        data = Packets.copyOf(data);
    }

    public ControlCommand(ControlCommandType controlCommandType) {
        this(controlCommandType, null);
    }

    @Override
    public byte[] data() {
        return data.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ControlCommand that)) return false;
        return controlCommandType == that.controlCommandType && Arrays.equals(data, that.data);
    }

    @Override
    public int hashCode() {
        return 31 * controlCommandType.hashCode() + Arrays.hashCode(data);
    }

    @Override
    public Level level() {
        return Level.CONTROL;
    }

    @Override
    public PacketType packetType() {
        return PacketType.CONTROL_COMMAND;
    }

    @Override
    public int size() {
        return HEADER_SIZE + data.length;
    }
}
