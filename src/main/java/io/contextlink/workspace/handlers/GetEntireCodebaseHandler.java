package io.contextlink.workspace.handlers;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.contextlink.protocol.Command;
import io.contextlink.protocol.Payloads;
import io.contextlink.server.ClientRecord;
import io.contextlink.workspace.WorkspaceContext;
import io.contextlink.workspace.WorkspaceFiles;
import io.contextlink.workspace.WorkspaceFolder;

import java.nio.file.Path;

public final class GetEntireCodebaseHandler extends WorkspaceHandler {
    public static final int MAX_FILES = 500;

    public GetEntireCodebaseHandler(WorkspaceContext workspace, String windowId) {
        super(workspace, windowId);
    }

    @Override
    public Command command() {
        return Command.GET_ENTIRE_CODEBASE;
    }

    @Override
    public JsonNode handle(JsonNode payload, ClientRecord client) {
        ObjectNode data = tagged();
        ArrayNode files = data.putArray("filesData");
        for (WorkspaceFolder folder : selectFolders(payload)) {
            int remaining = MAX_FILES - files.size();
            if (remaining <= 0) {
                break;
            }
            for (Path file : WorkspaceFiles.textFiles(folder.root(), remaining)) {
                ObjectNode item = fileData(file);
                item.put("relativePath", folder.relativize(file));
                item.put("workspaceFolderUri", folder.uri());
                item.put("windowId", windowId);
                files.add(item);
            }
        }
        data.put("truncated", files.size() >= MAX_FILES);
        return Payloads.ok(data);
    }
}
