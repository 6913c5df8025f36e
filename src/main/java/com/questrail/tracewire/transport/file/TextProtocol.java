package com.questrail.tracewire.transport.file;

import com.questrail.tracewire.codec.PacketFormatter;
import com.questrail.tracewire.codec.StreamHeaders;
import com.questrail.tracewire.codec.text.TextPacketFormatter;
import com.questrail.tracewire.config.ConnectionsBuilder;
import com.questrail.tracewire.config.ProtocolOptions;
import com.questrail.tracewire.internal.time.MonotonicClock;
import com.questrail.tracewire.internal.time.SystemMonotonicClock;
import com.questrail.tracewire.internal.time.SystemWallClock;
import com.questrail.tracewire.internal.time.WallClock;

import java.time.ZoneId;
import java.util.Locale;
import java.util.Objects;

/**
 * A {@link FileProtocol} that writes one UTF-8 text line per log entry.
 *
 * <p>Files start with a byte order mark instead of {@code SILF}. Options
 * {@code pattern} and {@code indent} control the line layout;
 * {@code encrypt} and {@code key} are not available.</p>
 */
public class TextProtocol extends FileProtocol {

    private final ZoneId zone;
    private String pattern = TextPacketFormatter.DEFAULT_PATTERN;
    private boolean indent;

    public TextProtocol(MonotonicClock monotonicClock, WallClock wallClock, ZoneId zone) {
        super(monotonicClock, wallClock);
        this.zone = Objects.requireNonNull(zone, "zone");
    }

    public TextProtocol() {
        this(SystemMonotonicClock.INSTANCE, SystemWallClock.INSTANCE, ZoneId.systemDefault());
    }

    @Override
    public String name() {
        return "text";
    }

    @Override
    protected String defaultFileName() {
        return "log.txt";
    }

    @Override
    protected PacketFormatter createFormatter() {
        return new TextPacketFormatter(pattern, indent, zone);
    }

    @Override
    protected byte[] streamHeader() {
        return StreamHeaders.utf8Bom();
    }

    @Override
    public boolean isValidOption(String name) {
        String n = name.toLowerCase(Locale.ROOT);
        if (n.equals("encrypt") || n.equals("key")) {
            return false;
        }
        return n.equals("pattern") || n.equals("indent") || super.isValidOption(name);
    }

    @Override
    protected void applyOptions(ProtocolOptions options) {
        pattern = options.getString("pattern", TextPacketFormatter.DEFAULT_PATTERN);
        indent = options.getBoolean("indent", false);
        super.applyOptions(options);
    }

    @Override
    protected void buildOptions(ConnectionsBuilder builder) {
        super.buildOptions(builder);
        builder.addOption("indent", indent);
        builder.addOption("pattern", pattern);
    }

    public String pattern() {
        return pattern;
    }

    public boolean indent() {
        return indent;
    }
}
