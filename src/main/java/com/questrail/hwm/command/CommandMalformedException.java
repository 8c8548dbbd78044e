package com.questrail.hwm.command;

/**
 * The raw request is not parseable JSON.
 */
public final class CommandMalformedException extends CommandException
{
    public CommandMalformedException(String message) {
        super(message);
    }

    public CommandMalformedException(String message, Throwable cause) {
        super(message, null, cause);
    }
}
