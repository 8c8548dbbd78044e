package com.questrail.hwm.device;

import com.questrail.hwm.command.CommandParser;
import com.questrail.hwm.internal.time.WallClock;
import com.questrail.hwm.pipeline.PipelineDirectory;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Collaborators handed to every driver at construction.
 *
 * <p>Devices are built before pipelines and before the command parser, so both
 * are reached indirectly: pipelines through a directory that the composition
 * root fills later, the parser through a supplier.</p>
 */
public record DeviceContext(
    PipelineDirectory pipelines,
    Supplier<CommandParser> commandParserSupplier,
    WallClock clock
) {
    public DeviceContext {
        Objects.requireNonNull(pipelines, "pipelines");
        Objects.requireNonNull(commandParserSupplier, "commandParserSupplier");
        Objects.requireNonNull(clock, "clock");
    }

    public CommandParser commandParser() {
        CommandParser parser = commandParserSupplier.get();
        if (parser == null) {
            throw new IllegalStateException("The command parser is not available yet");
        }
        return parser;
    }
}
