package com.questrail.tracewire.transport.file;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.temporal.TemporalAdjusters;
import java.util.Objects;

/**
 * Detects when the wall clock crosses a rotation boundary.
 *
 * <p>Each mode maps a UTC instant to a time value (hour number, day number,
 * number of the week's Monday, month number); a changed value means a
 * boundary was crossed since the last call.</p>
 */
public final class FileRotater {

    private FileRotate mode = FileRotate.NO_ROTATE;
    private long timeValue;

    public FileRotate mode() {
        return mode;
    }

    public void setMode(FileRotate mode) {
        this.mode = Objects.requireNonNull(mode, "mode");
    }

    /**
     * Anchors the rotater at {@code now} without reporting a boundary.
     */
    public void initialize(Instant now) {
        timeValue = timeValue(now);
    }

    /**
     * @return true if {@code now} is past the boundary of the current period;
     *         the new period becomes current
     */
    public boolean update(Instant now) {
        long value = timeValue(now);
        if (value != timeValue) {
            timeValue = value;
            return true;
        }
        return false;
    }

    long timeValue(Instant now) {
        LocalDateTime t = LocalDateTime.ofInstant(now, ZoneOffset.UTC);
        return switch (mode) {
            case HOURLY -> t.toLocalDate().toEpochDay() * 24 + t.getHour();
            case DAILY -> t.toLocalDate().toEpochDay();
            case WEEKLY -> t.toLocalDate().with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY)).toEpochDay();
            case MONTHLY -> t.getYear() * 12L + t.getMonthValue();
            case NO_ROTATE -> 0;
        };
    }
}
