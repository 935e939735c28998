package io.contextlink.workspace.handlers;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.contextlink.protocol.Command;
import io.contextlink.protocol.Payloads;
import io.contextlink.server.ClientRecord;
import io.contextlink.workspace.WorkspaceContext;
import io.contextlink.workspace.WorkspaceFolder;

import java.nio.file.Path;
import java.util.Optional;

public final class GetOpenFilesHandler extends WorkspaceHandler {
    public GetOpenFilesHandler(WorkspaceContext workspace, String windowId) {
        super(workspace, windowId);
    }

    @Override
    public Command command() {
        return Command.GET_OPEN_FILES;
    }

    @Override
    public JsonNode handle(JsonNode payload, ClientRecord client) {
        Path active = workspace.activeFile().orElse(null);
        ObjectNode data = tagged();
        ArrayNode openFiles = data.putArray("openFiles");
        for (Path file : workspace.openFiles()) {
            Optional<WorkspaceFolder> folder = workspace.folderFor(file);
            ObjectNode item = tagged();
            item.put("path", file.toString());
            item.put("name", fileName(file).toString());
            item.put("uri", file.toUri().toString());
            item.put("isActive", file.equals(active));
            item.put("workspaceFolderUri", folder.map(WorkspaceFolder::uri).orElse(null));
            item.put("workspaceFolderName", folder.map(WorkspaceFolder::name).orElse(null));
            openFiles.add(item);
        }
        return Payloads.ok(data);
    }
}
