package io.contextlink.workspace.handlers;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.contextlink.protocol.Command;
import io.contextlink.protocol.ErrorCode;
import io.contextlink.protocol.Payloads;
import io.contextlink.server.ClientRecord;
import io.contextlink.server.CommandException;
import io.contextlink.workspace.WorkspaceContext;
import io.contextlink.workspace.WorkspaceFiles;
import io.contextlink.workspace.WorkspaceFolder;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

public final class GetFileTreeHandler extends WorkspaceHandler {
    public GetFileTreeHandler(WorkspaceContext workspace, String windowId) {
        super(workspace, windowId);
    }

    @Override
    public Command command() {
        return Command.GET_FILE_TREE;
    }

    @Override
    public JsonNode handle(JsonNode payload, ClientRecord client) {
        List<WorkspaceFolder> folders = selectFolders(payload);
        if (folders.isEmpty()) {
            throw new CommandException(ErrorCode.INVALID_PAYLOAD,
                    "Unknown workspace folder: " + optionalText(payload, "workspaceFolderUri"));
        }
        WorkspaceFolder folder = folders.get(0);
        ObjectNode data = tagged();
        data.put("fileTreeString", render(folder.root()));
        data.set("metadata", metadata("file_tree", folder.name(), folder.root()));
        return Payloads.ok(data);
    }

    static String render(Path root) {
        StringBuilder sb = new StringBuilder();
        sb.append(fileName(root)).append('/').append('\n');
        WorkspaceFiles.walk(root, path -> {
            int depth = root.relativize(path).getNameCount();
            sb.append("  ".repeat(depth)).append(fileName(path));
            if (Files.isDirectory(path)) {
                sb.append('/');
            }
            sb.append('\n');
            return true;
        });
        return sb.toString();
    }
}
