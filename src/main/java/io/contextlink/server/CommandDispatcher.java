package io.contextlink.server;

import com.fasterxml.jackson.databind.JsonNode;
import io.contextlink.protocol.Command;
import io.contextlink.protocol.Envelope;
import io.contextlink.protocol.ErrorCode;
import io.contextlink.protocol.MessageType;
import io.contextlink.protocol.Payloads;
import io.contextlink.workspace.WorkspaceContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

public final class CommandDispatcher {
    private static final Logger LOG = LoggerFactory.getLogger(CommandDispatcher.class);

    private final CommandRegistry registry = new CommandRegistry();
    private final WorkspaceContext workspace;

    public CommandDispatcher(WorkspaceContext workspace) {
        this.workspace = workspace;
    }

    public CommandDispatcher register(CommandHandler handler) {
        registry.register(handler);
        return this;
    }

    public boolean supports(Command command) {
        return registry.contains(command);
    }

    public Envelope dispatch(Envelope request, ClientRecord client) {
        if (request.type() != MessageType.REQUEST) {
            return Envelope.error(request.messageId(), ErrorCode.INVALID_MESSAGE_TYPE,
                    "Expected a request, got " + request.type().wireName() + ".");
        }
        Optional<Command> command = Command.fromWire(request.command());
        if (command.isEmpty() || !registry.contains(command.get())) {
            LOG.warn("Unknown command '{}' from {}", request.command(), client == null ? "forwarded" : client.id());
            return Envelope.error(request.messageId(), ErrorCode.UNKNOWN_COMMAND,
                    "Unknown command: " + request.command());
        }
        JsonNode payload = execute(command.get(), request.payload(), client);
        return toEnvelope(request.messageId(), command.get(), payload);
    }

    public JsonNode execute(Command command, JsonNode payload, ClientRecord client) {
        Optional<CommandHandler> handler = registry.find(command);
        if (handler.isEmpty()) {
            return Payloads.error(ErrorCode.UNKNOWN_COMMAND, "Unknown command: " + command.wireName());
        }
        if (command.requiresWorkspace()) {
            if (!workspace.isOpen()) {
                return Payloads.error(ErrorCode.NO_WORKSPACE_OPEN, "No workspace folder is open.");
            }
            if (!workspace.isTrusted()) {
                return Payloads.error(ErrorCode.WORKSPACE_NOT_TRUSTED, "Workspace is not trusted.");
            }
        }
        try {
            JsonNode result = handler.get().handle(payload, client);
            return result == null ? Payloads.ok(null) : result;
        } catch (CommandException e) {
            LOG.debug("Command {} failed: {} {}", command.wireName(), e.errorCode(), e.getMessage());
            return Payloads.error(e.errorCode(), e.getMessage());
        } catch (RuntimeException e) {
            LOG.error("Command {} threw", command.wireName(), e);
            String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            return Payloads.error(ErrorCode.COMMAND_EXECUTION_ERROR, message);
        }
    }

    public static Envelope toEnvelope(String messageId, Command command, JsonNode payload) {
        if (Payloads.isFailure(payload)) {
            return Envelope.error(messageId, Payloads.errorCode(payload), Payloads.errorMessage(payload));
        }
        return Envelope.response(messageId, command.responseName(), payload);
    }
}
