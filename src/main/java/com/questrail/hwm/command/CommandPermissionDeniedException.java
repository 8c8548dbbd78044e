package com.questrail.hwm.command;

import java.util.Map;

/**
 * The issuing user's permission record does not include the command.
 */
public final class CommandPermissionDeniedException extends CommandException
{
    public CommandPermissionDeniedException(String userId, String commandName, String destination) {
        super("User '" + userId + "' is not permitted to execute '" + commandName + "' on " + destination + ".",
            Map.of("denied_command", commandName, "destination", destination));
    }
}
