package com.questrail.hwm.observability;

import java.time.Duration;
import java.time.Instant;

/**
 * Record describing a command that has been turned into a response envelope.
 *
 * @param deviceId     target device, or {@code null} for system commands
 * @param command      command name, or {@code null} when the request never validated
 * @param userId       issuing user, or {@code null} for internal commands
 * @param errorMessage failure message, or {@code null} on success
 */
public record CommandCompletedEvent(
    Instant timestamp,
    String command,
    String deviceId,
    String userId,
    boolean success,
    Duration elapsed,
    String errorMessage
) {
}
