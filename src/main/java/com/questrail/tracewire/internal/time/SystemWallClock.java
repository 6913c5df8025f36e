package com.questrail.tracewire.internal.time;

import java.time.Instant;

/**
 * SystemWallClock
 * =============================================================================
 * Production {@link WallClock} backed by {@link Instant#now()}.
 *
 * <h2>Thread Safety</h2>
 * <p>Thread-safe; {@link Instant#now()} is safe for concurrent access.</p>
 */
public enum SystemWallClock implements WallClock {
    /**
     * Singleton instance.
     */
    INSTANCE;

    @Override
    public Instant now() {
        return Instant.now();
    }
}
