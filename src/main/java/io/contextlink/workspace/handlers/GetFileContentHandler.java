package io.contextlink.workspace.handlers;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.contextlink.protocol.Command;
import io.contextlink.protocol.Payloads;
import io.contextlink.server.ClientRecord;
import io.contextlink.workspace.WorkspaceContext;

import java.nio.file.Path;

public final class GetFileContentHandler extends WorkspaceHandler {
    public GetFileContentHandler(WorkspaceContext workspace, String windowId) {
        super(workspace, windowId);
    }

    @Override
    public Command command() {
        return Command.GET_FILE_CONTENT;
    }

    @Override
    public JsonNode handle(JsonNode payload, ClientRecord client) {
        Path file = requireExistingFile(requireText(payload, "filePath"));
        ObjectNode data = tagged();
        data.set("fileData", fileData(file));
        data.set("metadata", metadata("file_content", fileName(file).toString(), file));
        return Payloads.ok(data);
    }
}
