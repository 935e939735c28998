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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

public final class ListFolderContentsHandler extends WorkspaceHandler {
    public ListFolderContentsHandler(WorkspaceContext workspace, String windowId) {
        super(workspace, windowId);
    }

    @Override
    public Command command() {
        return Command.LIST_FOLDER_CONTENTS;
    }

    @Override
    public JsonNode handle(JsonNode payload, ClientRecord client) {
        Path folder = resolve(requireText(payload, "folderUri"));
        if (!Files.isDirectory(folder)) {
            throw new CommandException(ErrorCode.FILE_NOT_FOUND, "Folder not found: " + folder);
        }
        List<Path> children;
        try (Stream<Path> stream = Files.list(folder)) {
            children = stream
                    .filter(path -> !WorkspaceFiles.isIgnored(path))
                    .sorted(Comparator.comparing((Path path) -> !Files.isDirectory(path))
                            .thenComparing(path -> fileName(path).toString()))
                    .toList();
        } catch (IOException e) {
            throw new CommandException(ErrorCode.COMMAND_EXECUTION_ERROR, "Failed to list " + folder + ": " + e.getMessage(), e);
        }
        ObjectNode data = tagged();
        ArrayNode entries = data.putArray("entries");
        for (Path child : children) {
            ObjectNode item = tagged();
            item.put("name", fileName(child).toString());
            item.put("type", Files.isDirectory(child) ? "folder" : "file");
            item.put("uri", child.toUri().toString());
            item.put("path", child.toString());
            entries.add(item);
        }
        data.put("parentFolderUri", folder.toUri().toString());
        return Payloads.ok(data);
    }
}
