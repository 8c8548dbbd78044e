package com.questrail.hwm.security;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Permission record for one user, as published by the station's user interface.
 *
 * @param generatedAt               time the record was generated upstream
 * @param ignoreSessionProtections  flag carried over from the permissions resource; not enforced yet
 */
public record UserPermissions(
    String userId,
    Instant generatedAt,
    boolean ignoreSessionProtections,
    List<PermittedCommand> permittedCommands
) {
    public UserPermissions {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(generatedAt, "generatedAt");
        permittedCommands = List.copyOf(Objects.requireNonNull(permittedCommands, "permittedCommands"));
    }

    /**
     * Returns whether the user may execute {@code commandName}.
     *
     * @param deviceId          target device, or {@code null} for a system command
     * @param systemHandlerName name of the system handler that would run a system command
     */
    public boolean permits(String commandName, String deviceId, String systemHandlerName) {
        for (PermittedCommand permitted : permittedCommands) {
            if (permitted.matches(commandName, deviceId, systemHandlerName)) {
                return true;
            }
        }
        return false;
    }
}
