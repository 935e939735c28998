package io.contextlink.workspace.handlers;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.contextlink.protocol.Command;
import io.contextlink.protocol.ErrorCode;
import io.contextlink.protocol.Payloads;
import io.contextlink.server.ClientRecord;
import io.contextlink.server.CommandException;
import io.contextlink.workspace.WorkspaceContext;
import io.contextlink.workspace.WorkspaceFolder;

import java.nio.file.Path;
import java.util.Optional;

public final class GetActiveFileInfoHandler extends WorkspaceHandler {
    public GetActiveFileInfoHandler(WorkspaceContext workspace, String windowId) {
        super(workspace, windowId);
    }

    @Override
    public Command command() {
        return Command.GET_ACTIVE_FILE_INFO;
    }

    @Override
    public JsonNode handle(JsonNode payload, ClientRecord client) {
        Path active = workspace.activeFile()
                .orElseThrow(() -> new CommandException(ErrorCode.NO_ACTIVE_FILE, "No active file."));
        Optional<WorkspaceFolder> folder = workspace.folderFor(active);
        ObjectNode data = tagged();
        data.put("activeFilePath", active.toString());
        data.put("activeFileLabel", fileName(active).toString());
        data.put("workspaceFolderUri", folder.map(WorkspaceFolder::uri).orElse(null));
        data.put("workspaceFolderName", folder.map(WorkspaceFolder::name).orElse(null));
        return Payloads.ok(data);
    }
}
