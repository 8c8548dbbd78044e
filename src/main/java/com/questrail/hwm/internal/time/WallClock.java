package com.questrail.hwm.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source for command timestamps, telemetry stamping and permission
 * record ageing.
 *
 * <p>
 * Injected wherever "now" matters so tests can substitute a manual clock.
 * </p>
 */
public interface WallClock
{
    /**
     * Returns the current wall-clock time.
     */
    Instant now();

    /**
     * Returns the current time as fractional UNIX seconds, the representation
     * used on the command wire.
     */
    default double nowEpochSeconds()
    {
        return toEpochSeconds(now());
    }

    static double toEpochSeconds(Instant instant)
    {
        return instant.getEpochSecond() + instant.getNano() / 1_000_000_000.0;
    }
}
