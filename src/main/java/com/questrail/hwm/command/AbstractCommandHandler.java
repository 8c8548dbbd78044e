package com.questrail.hwm.command;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Table-backed {@link CommandHandler}. Subclasses register their commands in
 * their constructor.
 */
public abstract class AbstractCommandHandler implements CommandHandler
{
    private final String name;
    private final Map<String, CommandMethod> commands = new LinkedHashMap<>();

    protected AbstractCommandHandler(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    protected final void register(String commandName, CommandMethod method) {
        Objects.requireNonNull(commandName, "commandName");
        Objects.requireNonNull(method, "method");
        if (commands.putIfAbsent(commandName, method) != null) {
            throw new IllegalArgumentException("Command '" + commandName + "' is already registered with " + name);
        }
    }

    @Override
    public final String name() {
        return name;
    }

    @Override
    public final Optional<CommandMethod> resolve(String commandName) {
        return Optional.ofNullable(commands.get(commandName));
    }

    @Override
    public final Set<String> commandNames() {
        return Collections.unmodifiableSet(commands.keySet());
    }
}
