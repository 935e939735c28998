package io.contextlink.workspace.handlers;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.contextlink.protocol.Command;
import io.contextlink.protocol.ErrorCode;
import io.contextlink.protocol.Payloads;
import io.contextlink.server.ClientRecord;
import io.contextlink.server.CommandException;
import io.contextlink.workspace.WorkspaceContext;

import java.nio.file.Path;

// A file that cannot be read lands in errors instead of failing the request.
public final class GetContentsForFilesHandler extends WorkspaceHandler {
    public GetContentsForFilesHandler(WorkspaceContext workspace, String windowId) {
        super(workspace, windowId);
    }

    @Override
    public Command command() {
        return Command.GET_CONTENTS_FOR_FILES;
    }

    @Override
    public JsonNode handle(JsonNode payload, ClientRecord client) {
        JsonNode uris = payload.path("fileUris");
        if (!uris.isArray()) {
            throw new CommandException(ErrorCode.INVALID_PAYLOAD, "Missing required field: fileUris");
        }
        ObjectNode data = tagged();
        ArrayNode contents = data.putArray("data");
        ArrayNode errors = data.putArray("errors");
        for (JsonNode entry : uris) {
            String uri = entry.asText("");
            try {
                Path file = requireExistingFile(uri);
                ObjectNode item = tagged();
                item.put("fileUri", uri);
                item.set("fileData", fileData(file));
                item.set("metadata", metadata("file_content", fileName(file).toString(), file));
                contents.add(item);
            } catch (CommandException e) {
                ObjectNode error = tagged();
                error.put("uri", uri);
                error.put("error", e.getMessage());
                error.put("errorCode", e.errorCode().name());
                errors.add(error);
            }
        }
        return Payloads.ok(data);
    }
}
