package com.questrail.tracewire.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for elapsed-time decisions such as the reconnect interval.
 *
 * <p>Wall-clock time may jump; anything that measures "how long since"
 * reads this clock instead. Values are only meaningful as differences.</p>
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     */
    long nowNanos();
}
