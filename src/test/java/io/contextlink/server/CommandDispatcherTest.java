package io.contextlink.server;

import com.fasterxml.jackson.databind.JsonNode;
import io.contextlink.protocol.Command;
import io.contextlink.protocol.Envelope;
import io.contextlink.protocol.ErrorCode;
import io.contextlink.protocol.MessageType;
import io.contextlink.protocol.Payloads;
import io.contextlink.util.Jsons;
import io.contextlink.workspace.LocalWorkspace;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class CommandDispatcherTest {
    @TempDir
    Path root;

    private static CommandHandler handler(Command command, Function<JsonNode, JsonNode> body) {
        return new CommandHandler() {
            @Override
            public Command command() {
                return command;
            }

            @Override
            public JsonNode handle(JsonNode payload, ClientRecord client) {
                return body.apply(payload);
            }
        };
    }

    private static ClientRecord client() {
        return new ClientRecord(new RecordingPeer(), true);
    }

    @Test
    void successShouldUseMappedResponseName() {
        CommandDispatcher dispatcher = new CommandDispatcher(LocalWorkspace.of(root))
                .register(handler(Command.GET_OPEN_FILES, payload -> Payloads.ok(Jsons.object())));
        Envelope request = Envelope.request("get_open_files", Jsons.object());

        Envelope response = dispatcher.dispatch(request, client());

        assertEquals(MessageType.RESPONSE, response.type());
        assertEquals("response_open_files", response.command());
        assertEquals(request.messageId(), response.messageId());
    }

    @Test
    void unknownCommandShouldBeRejected() {
        CommandDispatcher dispatcher = new CommandDispatcher(LocalWorkspace.of(root));
        Envelope response = dispatcher.dispatch(Envelope.request("format_disk", Jsons.object()), client());
        assertEquals(MessageType.ERROR_RESPONSE, response.type());
        assertEquals("UNKNOWN_COMMAND", response.payload().path("errorCode").asText());
    }

    @Test
    void workspaceGateShouldRunBeforeTheHandler() {
        AtomicBoolean invoked = new AtomicBoolean();
        CommandHandler guarded = handler(Command.SEARCH_WORKSPACE, payload -> {
            invoked.set(true);
            return Payloads.ok(null);
        });

        CommandDispatcher noWorkspace = new CommandDispatcher(LocalWorkspace.empty()).register(guarded);
        Envelope closed = noWorkspace.dispatch(Envelope.request("search_workspace", Jsons.object()), client());
        assertEquals("NO_WORKSPACE_OPEN", closed.payload().path("errorCode").asText());

        CommandDispatcher untrusted = new CommandDispatcher(new LocalWorkspace(List.of(root), false)).register(guarded);
        Envelope rejected = untrusted.dispatch(Envelope.request("search_workspace", Jsons.object()), client());
        assertEquals("WORKSPACE_NOT_TRUSTED", rejected.payload().path("errorCode").asText());

        assertFalse(invoked.get());
    }

    @Test
    void ungatedCommandsShouldRunWithoutWorkspace() {
        CommandDispatcher dispatcher = new CommandDispatcher(LocalWorkspace.empty())
                .register(handler(Command.REGISTER_ACTIVE_TARGET, payload -> Payloads.ack("ok")));
        Envelope response = dispatcher.dispatch(Envelope.request("register_active_target", Jsons.object()), client());
        assertEquals("response_generic_ack", response.command());
    }

    @Test
    void businessErrorsShouldKeepTheirCode() {
        CommandDispatcher dispatcher = new CommandDispatcher(LocalWorkspace.of(root))
                .register(handler(Command.GET_FILE_CONTENT, payload -> {
                    throw new CommandException(ErrorCode.FILE_NOT_FOUND, "File not found: a.txt");
                }));
        Envelope response = dispatcher.dispatch(Envelope.request("get_file_content", Jsons.object()), client());
        assertEquals(MessageType.ERROR_RESPONSE, response.type());
        assertEquals("FILE_NOT_FOUND", response.payload().path("errorCode").asText());
        assertEquals("File not found: a.txt", response.payload().path("error").asText());
    }

    @Test
    void unexpectedExceptionsShouldMapToExecutionError() {
        CommandDispatcher dispatcher = new CommandDispatcher(LocalWorkspace.of(root))
                .register(handler(Command.GET_FILE_TREE, payload -> {
                    throw new IllegalStateException("disk on fire");
                }));
        Envelope response = dispatcher.dispatch(Envelope.request("get_file_tree", Jsons.object()), client());
        assertEquals("COMMAND_EXECUTION_ERROR", response.payload().path("errorCode").asText());
        assertEquals("disk on fire", response.payload().path("error").asText());
    }

    @Test
    void nonRequestEnvelopesShouldBeRejected() {
        CommandDispatcher dispatcher = new CommandDispatcher(LocalWorkspace.of(root));
        Envelope answer = Envelope.response("m-1", "response_generic_ack", Jsons.object());
        assertEquals("INVALID_MESSAGE_TYPE", dispatcher.dispatch(answer, client()).payload().path("errorCode").asText());
    }
}
