package com.questrail.hwm.observability;

import java.time.Instant;
import java.util.List;

/**
 * Record representing a pipeline lock transition.
 */
public record ReservationEvent(
    Instant timestamp,
    String pipelineId,
    Kind kind,
    List<String> deviceIds,
    String reason
) {
    public enum Kind {
        RESERVED,
        REJECTED,
        FREED
    }

    public ReservationEvent {
        deviceIds = List.copyOf(deviceIds);
    }
}
