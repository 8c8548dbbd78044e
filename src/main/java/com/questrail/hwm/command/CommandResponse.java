package com.questrail.hwm.command;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.hwm.internal.time.WallClock;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Response envelope produced for every command, successful or not.
 *
 * <p>Wire form:</p>
 * <pre>
 * {"status": "okay"|"error", "device_id"?: string,
 *  "received_at": number, "completed_at": number, "result": object}
 * </pre>
 * Timestamps are UNIX seconds with a fractional part.
 */
public record CommandResponse(
    Status status,
    String deviceId,
    Instant receivedAt,
    Instant completedAt,
    Map<String, Object> result
) {
    private static final ObjectMapper JSON = new ObjectMapper();

    public enum Status {
        OKAY("okay"),
        ERROR("error");

        private final String wireName;

        Status(String wireName) {
            this.wireName = wireName;
        }

        public String wireName() {
            return wireName;
        }
    }

    public CommandResponse {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(receivedAt, "receivedAt");
        Objects.requireNonNull(completedAt, "completedAt");
        result = result == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(result));
    }

    /**
     * Builds an error envelope for a request that never became a {@link Command}
     * (for example a datagram from an unknown sender).
     */
    public static CommandResponse error(String message, Instant receivedAt, Instant completedAt) {
        return new CommandResponse(Status.ERROR, null, receivedAt, completedAt, Map.of("error_message", message));
    }

    public boolean isSuccess() {
        return status == Status.OKAY;
    }

    public Optional<String> device() {
        return Optional.ofNullable(deviceId);
    }

    /**
     * Returns {@code result.error_message} for error responses.
     */
    public Optional<String> errorMessage() {
        Object message = result.get("error_message");
        return message == null ? Optional.empty() : Optional.of(message.toString());
    }

    public Map<String, Object> toWireMap() {
        Map<String, Object> wire = new LinkedHashMap<>();
        wire.put("status", status.wireName());
        if (deviceId != null) {
            wire.put("device_id", deviceId);
        }
        wire.put("received_at", WallClock.toEpochSeconds(receivedAt));
        wire.put("completed_at", WallClock.toEpochSeconds(completedAt));
        wire.put("result", result);
        return wire;
    }

    public String toJson() {
        try {
            return JSON.writeValueAsString(toWireMap());
        } catch (JsonProcessingException e) {
            // Results are produced by handlers; an unserializable value is a handler bug.
            throw new IllegalStateException("Command result could not be serialized", e);
        }
    }
}
