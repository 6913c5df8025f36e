package com.questrail.tracewire.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * UTC time source for packet timestamps, event timestamps, file rotation
 * boundaries and rotated file names.
 *
 * <p>Injected everywhere calendar time matters so tests can step across an
 * hour, day or month boundary without waiting.</p>
 */
public interface WallClock
{
    /**
     * Returns the current wall-clock time.
     */
    Instant now();
}
