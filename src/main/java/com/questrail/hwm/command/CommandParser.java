package com.questrail.hwm.command;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.hwm.device.Device;
import com.questrail.hwm.device.DeviceRegistry;
import com.questrail.hwm.internal.exec.StationCoordinator;
import com.questrail.hwm.internal.time.WallClock;
import com.questrail.hwm.observability.CommandCompletedEvent;
import com.questrail.hwm.observability.NullObservabilitySink;
import com.questrail.hwm.observability.StationObservabilitySink;
import com.questrail.hwm.security.PermissionManager;
import com.questrail.hwm.security.UserPermissions;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;

/**
 * CommandParser
 * =============================================================================
 * Turns raw command text into a {@link CommandResponse}.
 *
 * <h2>Pipeline</h2>
 * <pre>
 *   raw text
 *     → validate                      (coordinator)
 *     → resolve handler and method    (coordinator)
 *     → check user permissions        (coordinator, user commands only)
 *     → execute method                (worker pool)
 *     → build response envelope
 * </pre>
 *
 * Every failure along the way becomes an error envelope: the future returned
 * by {@link #parseCommand(String, String)} always completes normally. A result
 * that cannot be written as JSON is reported as an error too.
 *
 * <h2>Destinations</h2>
 * A command without {@code device_id} goes to the system handler; otherwise to
 * the named device's handler. A method missing from the handler is reported
 * with {@code invalid_command} and {@code destination} in the error result.
 *
 * <h2>Trust</h2>
 * Commands submitted without a user id are issued by the station itself (for
 * example pipeline setup commands) and skip the permission check.
 */
public final class CommandParser
{
    private static final ObjectMapper JSON = new ObjectMapper();

    private final CommandHandler systemHandler;
    private final DeviceRegistry devices;
    private final PermissionManager permissions;
    private final StationCoordinator coordinator;
    private final Executor workers;
    private final WallClock clock;
    private final StationObservabilitySink observabilitySink;

    /**
     * @param permissions permission cache for user commands, or {@code null} to
     *                    accept every user command that resolves
     */
    public CommandParser(CommandHandler systemHandler,
                         DeviceRegistry devices,
                         PermissionManager permissions,
                         StationCoordinator coordinator,
                         Executor workers,
                         WallClock clock,
                         StationObservabilitySink observabilitySink)
    {
        this.systemHandler = Objects.requireNonNull(systemHandler, "systemHandler");
        this.devices = Objects.requireNonNull(devices, "devices");
        this.permissions = permissions;
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator");
        this.workers = Objects.requireNonNull(workers, "workers");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    /**
     * Parses and executes a command issued by the station itself.
     */
    public CompletableFuture<CommandResponse> parseCommand(String raw) {
        return parseCommand(raw, null);
    }

    /**
     * Parses and executes a command.
     *
     * @param userId issuing user, or {@code null} for a trusted internal command
     * @return a future that always completes with a response envelope
     */
    public CompletableFuture<CommandResponse> parseCommand(String raw, String userId) {
        Command command = new Command(raw, userId, clock.now());

        CompletableFuture<CommandMethod> resolved;
        if (coordinator.inEventLoop()) {
            try {
                resolved = CompletableFuture.completedFuture(resolve(command));
            } catch (RuntimeException e) {
                resolved = CompletableFuture.failedFuture(e);
            }
        } else {
            resolved = coordinator.submit(() -> resolve(command));
        }

        return resolved
            .thenCompose(method -> CompletableFuture.supplyAsync(() -> invoke(method, command), workers))
            .handle((result, error) -> respond(command, result, error));
    }

    private CommandMethod resolve(Command command) {
        command.validate();

        CommandHandler handler;
        if (command.deviceId() == null) {
            handler = systemHandler;
        } else {
            Device device = devices.getDevice(command.deviceId());
            handler = device.getCommandHandler();
        }

        CommandMethod method = handler.resolve(command.command())
            .orElseThrow(() -> new CommandNotFoundException(command.command(), handler.name()));

        if (command.userId().isPresent() && permissions != null) {
            String userId = command.userId().get();
            UserPermissions user = permissions.getUserPermissions(userId);
            if (!user.permits(command.command(), command.deviceId(), systemHandler.name())) {
                throw new CommandPermissionDeniedException(userId, command.command(), handler.name());
            }
        }
        return method;
    }

    private static Map<String, Object> invoke(CommandMethod method, Command command) {
        try {
            Map<String, Object> result = method.execute(command);
            return result == null ? Map.of() : result;
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new CompletionException(e);
        }
    }

    private CommandResponse respond(Command command, Map<String, Object> result, Throwable error) {
        Instant completedAt = clock.now();
        CommandResponse response;
        String errorMessage = null;

        if (error == null && !isWritable(result)) {
            error = new CommandException("The '" + command.command()
                + "' command produced a result that cannot be sent as JSON.");
        }

        if (error == null) {
            response = command.buildResponse(true, result, completedAt);
        } else {
            Throwable cause = unwrap(error);
            errorMessage = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();

            Map<String, Object> errorResult = new LinkedHashMap<>();
            if (cause instanceof CommandException commandError && isWritable(commandError.errorData())) {
                errorResult.putAll(commandError.errorData());
            }
            errorResult.put("error_message", errorMessage);
            response = command.buildResponse(false, errorResult, completedAt);
        }

        observabilitySink.onCommandCompleted(new CommandCompletedEvent(
            completedAt,
            command.command(),
            command.deviceId(),
            command.userId().orElse(null),
            error == null,
            Duration.between(command.receivedAt(), completedAt),
            errorMessage));
        return response;
    }

    private static boolean isWritable(Map<String, Object> result) {
        try {
            JSON.valueToTree(result);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
            && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }
}
