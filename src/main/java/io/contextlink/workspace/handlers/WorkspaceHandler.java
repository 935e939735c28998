package io.contextlink.workspace.handlers;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.contextlink.protocol.ErrorCode;
import io.contextlink.server.CommandException;
import io.contextlink.server.CommandHandler;
import io.contextlink.util.Jsons;
import io.contextlink.workspace.WorkspaceContext;
import io.contextlink.workspace.WorkspaceFiles;
import io.contextlink.workspace.WorkspaceFolder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

abstract class WorkspaceHandler implements CommandHandler {
    protected final WorkspaceContext workspace;
    protected final String windowId;

    WorkspaceHandler(WorkspaceContext workspace, String windowId) {
        this.workspace = workspace;
        this.windowId = windowId;
    }

    protected static String requireText(JsonNode payload, String field) {
        String value = payload == null ? "" : payload.path(field).asText("");
        if (value.isBlank()) {
            throw new CommandException(ErrorCode.INVALID_PAYLOAD, "Missing required field: " + field);
        }
        return value;
    }

    protected static String optionalText(JsonNode payload, String field) {
        String value = payload == null ? "" : payload.path(field).asText("");
        return value.isBlank() ? null : value;
    }

    protected List<WorkspaceFolder> selectFolders(JsonNode payload) {
        String uri = optionalText(payload, "workspaceFolderUri");
        if (uri == null) {
            return workspace.folders();
        }
        return workspace.folderByUri(uri).map(List::of).orElse(List.of());
    }

    protected Path resolve(String pathOrUri) {
        Path base = workspace.folders().isEmpty() ? null : workspace.folders().get(0).root();
        try {
            return WorkspaceFiles.toPath(pathOrUri, base);
        } catch (IllegalArgumentException e) {
            throw new CommandException(ErrorCode.INVALID_PAYLOAD, "Invalid path: " + pathOrUri, e);
        }
    }

    protected Path requireExistingFile(String pathOrUri) {
        Path file = resolve(pathOrUri);
        if (!Files.isRegularFile(file)) {
            throw new CommandException(ErrorCode.FILE_NOT_FOUND, "File not found: " + pathOrUri);
        }
        return file;
    }

    protected ObjectNode fileData(Path file) {
        ObjectNode node = Jsons.object();
        node.put("fullPath", file.toString());
        node.put("content", readText(file));
        node.put("languageId", WorkspaceFiles.languageId(file));
        return node;
    }

    protected static String readText(Path file) {
        try {
            return WorkspaceFiles.read(file);
        } catch (IOException e) {
            throw new CommandException(ErrorCode.COMMAND_EXECUTION_ERROR,
                    "Failed to read " + file + ": " + e.getMessage(), e);
        }
    }

    protected ObjectNode metadata(String type, String label, Path source) {
        ObjectNode node = Jsons.object();
        node.put("unique_block_id", UUID.randomUUID().toString());
        node.put("content_source_id", source.toUri().toString());
        node.put("type", type);
        node.put("label", label);
        Optional<WorkspaceFolder> folder = workspace.folderFor(source);
        node.put("workspaceFolderUri", folder.map(WorkspaceFolder::uri).orElse(null));
        node.put("workspaceFolderName", folder.map(WorkspaceFolder::name).orElse(null));
        node.put("windowId", windowId);
        return node;
    }

    protected ObjectNode tagged() {
        ObjectNode node = Jsons.object();
        node.put("windowId", windowId);
        return node;
    }

    protected static Path fileName(Path path) {
        Path name = path.getFileName();
        return name == null ? path : name;
    }
}
