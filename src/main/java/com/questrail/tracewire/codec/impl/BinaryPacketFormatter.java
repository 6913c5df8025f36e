package com.questrail.tracewire.codec.impl;

import com.questrail.tracewire.codec.PacketFormatter;
import com.questrail.tracewire.packet.ControlCommand;
import com.questrail.tracewire.packet.LogEntry;
import com.questrail.tracewire.packet.LogHeader;
import com.questrail.tracewire.packet.Packet;
import com.questrail.tracewire.packet.ProcessFlow;
import com.questrail.tracewire.packet.Watch;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * BinaryPacketFormatter
 * -----------------------------------------------------------------------------
 * Concrete {@link PacketFormatter} for the binary wire format.
 *
 * <p>Every packet is a 6 byte header (packet type, body size) followed by a
 * fixed-width block and then the variable-length strings and data. String
 * lengths are stored in the fixed block, their UTF-8 bytes in the variable
 * block, in the same order.</p>
 *
 * <p>{@link #compile(Packet)} encodes into a reusable buffer; the returned
 * length always equals the number of bytes {@link #write(OutputStream)}
 * emits.</p>
 */
public final class BinaryPacketFormatter implements PacketFormatter
{
    private static final int INITIAL_CAPACITY = 1024;

    private ByteBuffer buffer = newBuffer(INITIAL_CAPACITY);
    private int compiledSize;

    @Override
    public int compile(Packet packet)
    {
        Objects.requireNonNull(packet, "packet");

        buffer.clear();
        buffer.position(WireFormat.PACKET_HEADER_SIZE);

        if (packet instanceof LogEntry entry) {
            compileLogEntry(entry);
        } else if (packet instanceof Watch watch) {
            compileWatch(watch);
        } else if (packet instanceof ProcessFlow flow) {
            compileProcessFlow(flow);
        } else if (packet instanceof ControlCommand command) {
            compileControlCommand(command);
        } else if (packet instanceof LogHeader header) {
            compileLogHeader(header);
        }

        int bodySize = buffer.position() - WireFormat.PACKET_HEADER_SIZE;
        buffer.putShort(0, (short) packet.packetType().id());
        buffer.putInt(2, bodySize);
        compiledSize = buffer.position();
        return compiledSize;
    }

    @Override
    public void write(OutputStream out) throws IOException
    {
        if (compiledSize > 0) {
            out.write(buffer.array(), 0, compiledSize);
        }
    }

    private void compileLogEntry(LogEntry entry)
    {
        byte[] appName = utf8(entry.appName());
        byte[] sessionName = utf8(entry.sessionName());
        byte[] title = utf8(entry.title());
        byte[] hostName = utf8(entry.hostName());
        byte[] data = entry.data();

        ensure(WireFormat.LOG_ENTRY_FIXED + appName.length + sessionName.length
            + title.length + hostName.length + data.length);

        buffer.putInt(entry.logEntryType().id());
        buffer.putInt(entry.viewerId().id());
        buffer.putInt(appName.length);
        buffer.putInt(sessionName.length);
        buffer.putInt(title.length);
        buffer.putInt(hostName.length);
        buffer.putInt(data.length);
        buffer.putInt(entry.processId());
        buffer.putInt(entry.threadId());
        buffer.putDouble(OleDateTime.fromInstant(entry.timestamp()));
        buffer.putInt(entry.color());

        buffer.put(appName);
        buffer.put(sessionName);
        buffer.put(title);
        buffer.put(hostName);
        buffer.put(data);
    }

    private void compileWatch(Watch watch)
    {
        byte[] name = utf8(watch.name());
        byte[] value = utf8(watch.value());

        ensure(WireFormat.WATCH_FIXED + name.length + value.length);

        buffer.putInt(name.length);
        buffer.putInt(value.length);
        buffer.putInt(watch.watchType().id());
        buffer.putDouble(OleDateTime.fromInstant(watch.timestamp()));

        buffer.put(name);
        buffer.put(value);
    }

    private void compileProcessFlow(ProcessFlow flow)
    {
        byte[] title = utf8(flow.title());
        byte[] hostName = utf8(flow.hostName());

        ensure(WireFormat.PROCESS_FLOW_FIXED + title.length + hostName.length);

        buffer.putInt(flow.processFlowType().id());
        buffer.putInt(title.length);
        buffer.putInt(hostName.length);
        buffer.putInt(flow.processId());
        buffer.putInt(flow.threadId());
        buffer.putDouble(OleDateTime.fromInstant(flow.timestamp()));

        buffer.put(title);
        buffer.put(hostName);
    }

    private void compileControlCommand(ControlCommand command)
    {
        byte[] data = command.data();

        ensure(WireFormat.CONTROL_COMMAND_FIXED + data.length);

        buffer.putInt(command.controlCommandType().id());
        buffer.putInt(data.length);
        buffer.put(data);
    }

    private void compileLogHeader(LogHeader header)
    {
        byte[] content = utf8(header.content());

        ensure(WireFormat.LOG_HEADER_FIXED + content.length);

        buffer.putInt(content.length);
        buffer.put(content);
    }

    private void ensure(int bodySize)
    {
        int required = WireFormat.PACKET_HEADER_SIZE + bodySize;
        if (buffer.capacity() < required) {
            buffer = newBuffer(Math.max(required, buffer.capacity() * 2));
            buffer.position(WireFormat.PACKET_HEADER_SIZE);
        }
    }

    private static ByteBuffer newBuffer(int capacity)
    {
        return ByteBuffer.allocate(capacity).order(ByteOrder.LITTLE_ENDIAN);
    }

    private static byte[] utf8(String s)
    {
        return s.getBytes(StandardCharsets.UTF_8);
    }
}
