package io.contextlink.window;

import com.fasterxml.jackson.databind.JsonNode;
import io.contextlink.protocol.Command;
import io.contextlink.protocol.ErrorCode;
import io.contextlink.protocol.Payloads;
import io.contextlink.server.ClientRecord;
import io.contextlink.server.CommandException;
import io.contextlink.server.CommandHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

final class RegisterSecondaryHandler implements CommandHandler {
    private static final Logger LOG = LoggerFactory.getLogger(RegisterSecondaryHandler.class);

    private final SecondaryRegistry registry;
    private final BooleanSupplier isPrimary;
    private final Consumer<String> onRemoved;

    RegisterSecondaryHandler(SecondaryRegistry registry, BooleanSupplier isPrimary, Consumer<String> onRemoved) {
        this.registry = registry;
        this.isPrimary = isPrimary;
        this.onRemoved = onRemoved;
    }

    @Override
    public Command command() {
        return Command.REGISTER_SECONDARY;
    }

    @Override
    public JsonNode handle(JsonNode payload, ClientRecord client) {
        if (!isPrimary.getAsBoolean()) {
            throw new CommandException(ErrorCode.NOT_PRIMARY, "This window is not the Primary.");
        }
        if (client == null) {
            throw new CommandException(ErrorCode.INVALID_PAYLOAD, "Secondaries must register over their own connection.");
        }
        String windowId = payload.path("windowId").asText("");
        if (windowId.isBlank()) {
            throw new CommandException(ErrorCode.INVALID_PAYLOAD, "Missing required field: windowId");
        }
        int port = payload.path("port").asInt(0);
        List<SecondaryRegistration> displaced = registry.register(windowId, port, client);
        boolean replaced = false;
        for (SecondaryRegistration old : displaced) {
            if (old.windowId().equals(windowId)) {
                replaced = true;
            } else {
                LOG.info("Secondary {} dropped; its connection re-registered as {}", old.windowId(), windowId);
                onRemoved.accept(old.windowId());
            }
        }
        LOG.info("Secondary {} {} ({} registered)", windowId, replaced ? "re-registered" : "registered", registry.size());
        return Payloads.ack("Secondary registered.");
    }
}
