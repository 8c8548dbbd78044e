package com.questrail.hwm.observability;

import java.time.Instant;

/**
 * Record representing a session lifecycle transition on a pipeline.
 *
 * @param cause failure cause for {@link Kind#START_FAILED}, otherwise {@code null}
 */
public record SessionEvent(
    Instant timestamp,
    String reservationId,
    String pipelineId,
    Kind kind,
    Throwable cause
) {
    public enum Kind {
        STARTED,
        START_FAILED,
        ENDED
    }
}
