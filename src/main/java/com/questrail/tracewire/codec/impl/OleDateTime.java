package com.questrail.tracewire.codec.impl;

import java.time.Instant;

/**
 * Conversion between {@link Instant} and the OLE automation date used on
 * the wire: a double counting days since 1899-12-30 UTC, the fraction being
 * the time of day.
 */
public final class OleDateTime {

    static final long MICROS_PER_DAY = 86_400_000_000L;
    static final long EPOCH_OFFSET_DAYS = 25_569L;

    private OleDateTime() {
    }

    public static double fromInstant(Instant instant) {
        long micros = Math.addExact(
            Math.multiplyExact(instant.getEpochSecond(), 1_000_000L),
            instant.getNano() / 1_000);
        // single rounding step: numerator is exact below 2^53
        return (double) (micros + EPOCH_OFFSET_DAYS * MICROS_PER_DAY) / MICROS_PER_DAY;
    }

    public static Instant toInstant(double oleDate) {
        long micros = Math.round(oleDate * MICROS_PER_DAY) - EPOCH_OFFSET_DAYS * MICROS_PER_DAY;
        return Instant.ofEpochSecond(
            Math.floorDiv(micros, 1_000_000L),
            Math.floorMod(micros, 1_000_000L) * 1_000L);
    }
}
