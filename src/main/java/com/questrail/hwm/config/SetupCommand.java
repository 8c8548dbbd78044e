package com.questrail.hwm.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A command issued automatically while a pipeline or session is being set up.
 *
 * @param deviceId   target device, or {@code null} to address the system handler
 * @param command    command name
 * @param parameters command parameters (may be empty)
 */
public record SetupCommand(
    String deviceId,
    String command,
    Map<String, Object> parameters
) {
    public SetupCommand {
        Objects.requireNonNull(command, "command");
        parameters = parameters == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public static SetupCommand system(String command) {
        return new SetupCommand(null, command, Map.of());
    }

    public static SetupCommand device(String deviceId, String command) {
        return new SetupCommand(Objects.requireNonNull(deviceId, "deviceId"), command, Map.of());
    }

    public Optional<String> target() {
        return Optional.ofNullable(deviceId);
    }

    /**
     * Returns the command request object that this setup command submits to the parser.
     */
    public Map<String, Object> toRequest() {
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("command", command);
        if (deviceId != null) {
            request.put("device_id", deviceId);
        }
        if (!parameters.isEmpty()) {
            request.put("parameters", parameters);
        }
        return request;
    }
}
