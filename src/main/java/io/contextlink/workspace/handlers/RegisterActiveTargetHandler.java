package io.contextlink.workspace.handlers;

import com.fasterxml.jackson.databind.JsonNode;
import io.contextlink.protocol.Command;
import io.contextlink.protocol.ErrorCode;
import io.contextlink.protocol.Payloads;
import io.contextlink.server.ClientRecord;
import io.contextlink.server.CommandException;
import io.contextlink.server.CommandHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class RegisterActiveTargetHandler implements CommandHandler {
    private static final Logger LOG = LoggerFactory.getLogger(RegisterActiveTargetHandler.class);

    @Override
    public Command command() {
        return Command.REGISTER_ACTIVE_TARGET;
    }

    @Override
    public JsonNode handle(JsonNode payload, ClientRecord client) {
        if (client == null) {
            throw new CommandException(ErrorCode.INVALID_PAYLOAD, "Active target must be registered by a connected client.");
        }
        String tabId = payload.path("tabId").asText("");
        if (tabId.isBlank()) {
            throw new CommandException(ErrorCode.INVALID_PAYLOAD, "Missing required field: tabId");
        }
        String host = payload.path("llmHost").asText("");
        client.markActiveTarget(tabId, host.isBlank() ? null : host);
        LOG.info("Active target registered: tab {} on {}", tabId, host.isBlank() ? "unknown host" : host);
        return Payloads.ack("Active target registered.");
    }
}
