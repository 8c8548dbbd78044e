package com.questrail.hwm.security;

import java.util.Objects;

/**
 * One command a user may execute.
 *
 * @param command              command name
 * @param deviceId             device the command may target, or {@code null} for a system command
 * @param systemCommandHandler restricts a system command to one named system handler; {@code null} for any
 */
public record PermittedCommand(String command, String deviceId, String systemCommandHandler) {
    public PermittedCommand {
        Objects.requireNonNull(command, "command");
    }

    public static PermittedCommand system(String command) {
        return new PermittedCommand(command, null, null);
    }

    public static PermittedCommand device(String command, String deviceId) {
        return new PermittedCommand(command, Objects.requireNonNull(deviceId, "deviceId"), null);
    }

    boolean matches(String commandName, String targetDeviceId, String systemHandlerName) {
        if (!command.equals(commandName)) {
            return false;
        }
        if (targetDeviceId != null) {
            return targetDeviceId.equals(deviceId);
        }
        return deviceId == null && (systemCommandHandler == null || systemCommandHandler.equals(systemHandlerName));
    }
}
