package io.contextlink.server;

import io.contextlink.protocol.Command;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

public final class CommandRegistry {
    private final Map<Command, CommandHandler> handlers = new EnumMap<>(Command.class);

    public synchronized void register(CommandHandler handler) {
        handlers.put(handler.command(), handler);
    }

    public synchronized Optional<CommandHandler> find(Command command) {
        return Optional.ofNullable(handlers.get(command));
    }

    public synchronized boolean contains(Command command) {
        return handlers.containsKey(command);
    }
}
