package com.questrail.tracewire.codec.impl;

import com.questrail.tracewire.codec.PacketDecodeException;
import com.questrail.tracewire.packet.ControlCommand;
import com.questrail.tracewire.packet.ControlCommandType;
import com.questrail.tracewire.packet.Level;
import com.questrail.tracewire.packet.LogEntry;
import com.questrail.tracewire.packet.LogEntryType;
import com.questrail.tracewire.packet.LogHeader;
import com.questrail.tracewire.packet.Packet;
import com.questrail.tracewire.packet.PacketType;
import com.questrail.tracewire.packet.ProcessFlow;
import com.questrail.tracewire.packet.ProcessFlowType;
import com.questrail.tracewire.packet.ViewerId;
import com.questrail.tracewire.packet.Watch;
import com.questrail.tracewire.packet.WatchType;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * BinaryPacketReader
 * -----------------------------------------------------------------------------
 * Mechanical inverse of {@link BinaryPacketFormatter}.
 *
 * <p>The reader exists for verification and tooling: it reads a stream of
 * packets as produced by the file and memory protocols. The level of a packet
 * is not part of the wire format; decoded control commands and log headers
 * carry {@link Level#CONTROL}, every other packet {@link Level#MESSAGE}.</p>
 *
 * <p>Malformed input raises {@link PacketDecodeException}.</p>
 */
public final class BinaryPacketReader
{
    private final InputStream in;

    public BinaryPacketReader(InputStream in)
    {
        this.in = Objects.requireNonNull(in, "in");
    }

    /**
     * Reads the 4 byte eye-catcher of a plain stream.
     *
     * @return the eye-catcher as ASCII text (normally {@code SILF})
     */
    public String readStreamHeader() throws IOException
    {
        byte[] header = readFully(4);
        if (header == null) {
            throw new PacketDecodeException("Stream is empty");
        }
        return new String(header, StandardCharsets.US_ASCII);
    }

    /**
     * Reads the next packet.
     *
     * @return the packet, or {@code null} at a clean end of stream
     */
    public Packet readPacket() throws IOException
    {
        byte[] headerBytes = readFully(WireFormat.PACKET_HEADER_SIZE);
        if (headerBytes == null) {
            return null;
        }

        ByteBuffer header = wrap(headerBytes);
        int typeId = Short.toUnsignedInt(header.getShort());
        int bodySize = header.getInt();
        if (bodySize < 0) {
            throw new PacketDecodeException("Negative body size: " + bodySize);
        }

        byte[] bodyBytes = readFully(bodySize);
        if (bodyBytes == null) {
            throw new PacketDecodeException("Truncated packet body");
        }

        try {
            ByteBuffer body = wrap(bodyBytes);
            PacketType type = PacketType.fromId(typeId);
            return switch (type) {
                case LOG_ENTRY -> readLogEntry(body);
                case WATCH -> readWatch(body);
                case PROCESS_FLOW -> readProcessFlow(body);
                case CONTROL_COMMAND -> readControlCommand(body);
                case LOG_HEADER -> readLogHeader(body);
            };
        } catch (BufferUnderflowException | IllegalArgumentException e) {
            throw new PacketDecodeException("Malformed packet body (type " + typeId + ")", e);
        }
    }

    /**
     * Reads all remaining packets.
     */
    public List<Packet> readAll() throws IOException
    {
        List<Packet> packets = new ArrayList<>();
        Packet p;
        while ((p = readPacket()) != null) {
            packets.add(p);
        }
        return packets;
    }

    private static LogEntry readLogEntry(ByteBuffer body)
    {
        LogEntryType logEntryType = LogEntryType.fromId(body.getInt());
        ViewerId viewerId = ViewerId.fromId(body.getInt());
        int appNameLen = body.getInt();
        int sessionNameLen = body.getInt();
        int titleLen = body.getInt();
        int hostNameLen = body.getInt();
        int dataLen = body.getInt();
        int processId = body.getInt();
        int threadId = body.getInt();
        double timestamp = body.getDouble();
        int color = body.getInt();

        String appName = string(body, appNameLen);
        String sessionName = string(body, sessionNameLen);
        String title = string(body, titleLen);
        String hostName = string(body, hostNameLen);
        byte[] data = bytes(body, dataLen);

        return new LogEntry(Level.MESSAGE, logEntryType, viewerId, title, appName, sessionName,
            hostName, data, processId, threadId, OleDateTime.toInstant(timestamp), color);
    }

    private static Watch readWatch(ByteBuffer body)
    {
        int nameLen = body.getInt();
        int valueLen = body.getInt();
        WatchType watchType = WatchType.fromId(body.getInt());
        double timestamp = body.getDouble();
        String name = string(body, nameLen);
        String value = string(body, valueLen);
        return new Watch(Level.MESSAGE, name, value, watchType, OleDateTime.toInstant(timestamp));
    }

    private static ProcessFlow readProcessFlow(ByteBuffer body)
    {
        ProcessFlowType type = ProcessFlowType.fromId(body.getInt());
        int titleLen = body.getInt();
        int hostNameLen = body.getInt();
        int processId = body.getInt();
        int threadId = body.getInt();
        double timestamp = body.getDouble();
        String title = string(body, titleLen);
        String hostName = string(body, hostNameLen);
        return new ProcessFlow(Level.MESSAGE, type, title, hostName, processId, threadId,
            OleDateTime.toInstant(timestamp));
    }

    private static ControlCommand readControlCommand(ByteBuffer body)
    {
        ControlCommandType type = ControlCommandType.fromId(body.getInt());
        int dataLen = body.getInt();
        return new ControlCommand(type, bytes(body, dataLen));
    }

    private static LogHeader readLogHeader(ByteBuffer body)
    {
        String content = string(body, body.getInt());
        String hostName = "";
        String appName = "";
        for (String line : content.split("\r\n")) {
            int eq = line.indexOf('=');
            if (eq < 0) {
                continue;
            }
            String key = line.substring(0, eq);
            String value = line.substring(eq + 1);
            if (key.equals("hostname")) {
                hostName = value;
            } else if (key.equals("appname")) {
                appName = value;
            }
        }
        return new LogHeader(appName, hostName);
    }

    private static String string(ByteBuffer body, int length)
    {
        return new String(bytes(body, length), StandardCharsets.UTF_8);
    }

    private static byte[] bytes(ByteBuffer body, int length)
    {
        if (length < 0 || length > body.remaining()) {
            throw new PacketDecodeException("Field length " + length + " exceeds packet body");
        }
        byte[] b = new byte[length];
        body.get(b);
        return b;
    }

    private static ByteBuffer wrap(byte[] bytes)
    {
        return ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
    }

    /**
     * @return the bytes, or {@code null} if the stream ended before the first byte
     */
    private byte[] readFully(int length) throws IOException
    {
        byte[] b = in.readNBytes(length);
        if (b.length == 0 && length > 0) {
            return null;
        }
        if (b.length < length) {
            throw new EOFException("Expected " + length + " bytes, got " + b.length);
        }
        return b;
    }
}
