package com.questrail.hwm.command;

import java.util.Map;

/**
 * The addressed command handler has no command with the requested name.
 */
public final class CommandNotFoundException extends CommandException
{
    public CommandNotFoundException(String commandName, String destination) {
        super("The received command could not be located in the " + destination + " command handler.",
            Map.of("invalid_command", commandName, "destination", destination));
    }
}
