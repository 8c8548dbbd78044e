package com.questrail.hwm.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly in the hardware manager.
 */
public record StationErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
