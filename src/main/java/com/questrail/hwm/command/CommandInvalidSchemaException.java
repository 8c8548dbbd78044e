package com.questrail.hwm.command;

/**
 * The request is JSON but does not match the command shape.
 */
public final class CommandInvalidSchemaException extends CommandException
{
    public CommandInvalidSchemaException(String message) {
        super(message);
    }

    public CommandInvalidSchemaException(String message, Throwable cause) {
        super(message, null, cause);
    }
}
