package com.questrail.hwm.pipeline;

import com.questrail.hwm.command.CommandResponse;
import com.questrail.hwm.config.SetupCommand;

import java.util.Objects;

/**
 * A setup command produced an error response; the setup sequence stops there.
 */
public final class SetupCommandFailedException extends PipelineException
{
    private final SetupCommand command;
    private final CommandResponse response;

    public SetupCommandFailedException(String message, SetupCommand command, CommandResponse response) {
        super(message);
        this.command = Objects.requireNonNull(command, "command");
        this.response = Objects.requireNonNull(response, "response");
    }

    public SetupCommand command() {
        return command;
    }

    public CommandResponse response() {
        return response;
    }
}
