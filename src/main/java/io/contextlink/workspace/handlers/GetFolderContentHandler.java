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
import io.contextlink.workspace.WorkspaceFiles;

import java.nio.file.Files;
import java.nio.file.Path;

public final class GetFolderContentHandler extends WorkspaceHandler {
    public GetFolderContentHandler(WorkspaceContext workspace, String windowId) {
        super(workspace, windowId);
    }

    @Override
    public Command command() {
        return Command.GET_FOLDER_CONTENT;
    }

    @Override
    public JsonNode handle(JsonNode payload, ClientRecord client) {
        Path folder = resolve(requireText(payload, "folderPath"));
        if (!Files.isDirectory(folder)) {
            throw new CommandException(ErrorCode.FILE_NOT_FOUND, "Folder not found: " + folder);
        }
        ObjectNode data = tagged();
        ArrayNode files = data.putArray("filesData");
        for (Path file : WorkspaceFiles.textFiles(folder, GetEntireCodebaseHandler.MAX_FILES)) {
            ObjectNode item = fileData(file);
            item.put("windowId", windowId);
            files.add(item);
        }
        data.set("metadata", metadata("folder_content", fileName(folder).toString(), folder));
        return Payloads.ok(data);
    }
}
