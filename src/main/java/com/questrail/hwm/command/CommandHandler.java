package com.questrail.hwm.command;

import java.util.Optional;
import java.util.Set;

/**
 * CommandHandler
 * -----------------------------------------------------------------------------
 * Target of parsed commands. The system handler receives commands without a
 * {@code device_id}; each device may offer its own handler for commands
 * addressed to it.
 *
 * <p>Commands are resolved by name through an explicit table; a missing entry
 * is reported to the user as an unknown command.</p>
 */
public interface CommandHandler
{
    /**
     * Handler name: the device id for device handlers, the system handler name otherwise.
     */
    String name();

    Optional<CommandMethod> resolve(String commandName);

    Set<String> commandNames();
}
