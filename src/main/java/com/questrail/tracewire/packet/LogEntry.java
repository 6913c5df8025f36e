package com.questrail.tracewire.packet;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * A log message with an optional data block.
 *
 * <p>{@code color} is 32-bit RGBA packed as {@code R | G<<8 | B<<16 | A<<24}.</p>
 */
public record LogEntry(
    Level level,
    LogEntryType logEntryType,
    ViewerId viewerId,
    String title,
    String appName,
    String sessionName,
    String hostName,
    byte[] data,
    int processId,
    int threadId,
    Instant timestamp,
    int color
) implements Packet {

    static final int HEADER_SIZE = 48;

    public LogEntry {
        Objects.requireNonNull(level, "level");
        Objects.requireNonNull(logEntryType, "logEntryType");
        Objects.requireNonNull(viewerId, "viewerId");
        Objects.requireNonNull(timestamp, "timestamp");
        title = Packets.nullToEmpty(title);
        appName = Packets.nullToEmpty(appName);
        sessionName = Packets.nullToEmpty(sessionName);
        hostName = Packets.nullToEmpty(hostName);
        data = Packets.copyOf(data);
    }

    @Override
    public byte[] data() {
        return data.clone();
    }

    @Override
    public PacketType packetType() {
        return PacketType.LOG_ENTRY;
    }

    @Override
    public int size() {
        return HEADER_SIZE
            + Packet.stringSize(title)
            + Packet.stringSize(appName)
            + Packet.stringSize(sessionName)
            + Packet.stringSize(hostName)
            + data.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LogEntry that)) return false;
        return processId == that.processId
            && threadId == that.threadId
            && color == that.color
            && level == that.level
            && logEntryType == that.logEntryType
            && viewerId == that.viewerId
            && title.equals(that.title)
            && appName.equals(that.appName)
            && sessionName.equals(that.sessionName)
            && hostName.equals(that.hostName)
            && Arrays.equals(data, that.data)
            && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(level, logEntryType, viewerId, title, appName, sessionName, hostName,
            processId, threadId, timestamp, color);
        return 31 * result + Arrays.hashCode(data);
    }

    public static Builder builder(LogEntryType logEntryType, ViewerId viewerId) {
        return new Builder(logEntryType, viewerId);
    }

    public static final class Builder {
        private final LogEntryType logEntryType;
        private final ViewerId viewerId;
        private Level level = Level.MESSAGE;
        private String title = "";
        private String appName = "";
        private String sessionName = "";
        private String hostName = "";
        private byte[] data;
        private int processId = Packets.currentProcessId();
        private int threadId = Packets.currentThreadId();
        private Instant timestamp;
        private int color = Packets.DEFAULT_COLOR;

        private Builder(LogEntryType logEntryType, ViewerId viewerId) {
            this.logEntryType = Objects.requireNonNull(logEntryType, "logEntryType");
            this.viewerId = Objects.requireNonNull(viewerId, "viewerId");
        }

        public Builder withLevel(Level level) { this.level = level; return this; }
        public Builder withTitle(String title) { this.title = title; return this; }
        public Builder withAppName(String appName) { this.appName = appName; return this; }
        public Builder withSessionName(String sessionName) { this.sessionName = sessionName; return this; }
        public Builder withHostName(String hostName) { this.hostName = hostName; return this; }
        public Builder withData(byte[] data) { this.data = data; return this; }
        public Builder withProcessId(int processId) { this.processId = processId; return this; }
        public Builder withThreadId(int threadId) { this.threadId = threadId; return this; }
        public Builder withTimestamp(Instant timestamp) { this.timestamp = timestamp; return this; }
        public Builder withColor(int color) { this.color = color; return this; }

        public LogEntry build() {
            return new LogEntry(level, logEntryType, viewerId, title, appName, sessionName, hostName,
                data, processId, threadId, timestamp != null ? timestamp : Instant.now(), color);
        }
    }
}
