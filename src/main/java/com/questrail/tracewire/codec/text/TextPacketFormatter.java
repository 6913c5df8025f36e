package com.questrail.tracewire.codec.text;

import com.questrail.tracewire.codec.PacketFormatter;
import com.questrail.tracewire.packet.LogEntry;
import com.questrail.tracewire.packet.Packet;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.ZoneId;

/**
 * Renders log entries as UTF-8 text lines terminated by CRLF. Every other
 * packet kind compiles to zero bytes and is skipped.
 */
public final class TextPacketFormatter implements PacketFormatter
{
    public static final String DEFAULT_PATTERN = "[%timestamp%] %level%: %title%";

    private final PatternParser parser;
    private byte[] line;

    public TextPacketFormatter(String pattern, boolean indent, ZoneId zone)
    {
        this.parser = new PatternParser(pattern, indent, zone);
    }

    public TextPacketFormatter(String pattern, boolean indent)
    {
        this(pattern, indent, ZoneId.systemDefault());
    }

    @Override
    public int compile(Packet packet)
    {
        if (packet instanceof LogEntry entry) {
            line = (parser.expand(entry) + "\r\n").getBytes(StandardCharsets.UTF_8);
            return line.length;
        }
        line = null;
        return 0;
    }

    @Override
    public void write(OutputStream out) throws IOException
    {
        if (line != null) {
            out.write(line);
        }
    }
}
