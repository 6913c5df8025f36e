package com.questrail.tracewire.packet;

/**
 * Session preamble sent by socket and pipe protocols right after the
 * handshake. Identifies the sending application and host.
 */
public record LogHeader(String appName, String hostName) implements Packet {

    static final int HEADER_SIZE = 4;

    public LogHeader {
        appName = Packets.nullToEmpty(appName);
        hostName = Packets.nullToEmpty(hostName);
    }

    /** Key/value content as written to the wire. */
    public String content() {
        return "hostname=" + hostName + "\r\nappname=" + appName + "\r\n";
    }

    @Override
    public Level level() {
        return Level.CONTROL;
    }

    @Override
    public PacketType packetType() {
        return PacketType.LOG_HEADER;
    }

    @Override
    public int size() {
        return HEADER_SIZE + Packet.stringSize(content());
    }
}
