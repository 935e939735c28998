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

import java.util.function.Consumer;

final class UnregisterSecondaryHandler implements CommandHandler {
    private static final Logger LOG = LoggerFactory.getLogger(UnregisterSecondaryHandler.class);

    private final SecondaryRegistry registry;
    private final Consumer<String> onRemoved;

    UnregisterSecondaryHandler(SecondaryRegistry registry, Consumer<String> onRemoved) {
        this.registry = registry;
        this.onRemoved = onRemoved;
    }

    @Override
    public Command command() {
        return Command.UNREGISTER_SECONDARY;
    }

    @Override
    public JsonNode handle(JsonNode payload, ClientRecord client) {
        String windowId = payload.path("windowId").asText("");
        if (windowId.isBlank()) {
            throw new CommandException(ErrorCode.INVALID_PAYLOAD, "Missing required field: windowId");
        }
        boolean removed = registry.unregister(windowId).isPresent();
        if (client != null && windowId.equals(client.windowId().orElse(null))) {
            client.clearSecondary();
        }
        if (removed) {
            onRemoved.accept(windowId);
        }
        LOG.info("Secondary {} unregistered{}", windowId, removed ? "" : " (was not registered)");
        return Payloads.ack(removed ? "Secondary unregistered." : "Secondary was not registered.");
    }
}
