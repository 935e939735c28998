package io.contextlink.push;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.contextlink.protocol.ErrorCode;
import io.contextlink.server.CommandException;
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

public final class SnippetPush {
    private SnippetPush() {
    }

    public static ObjectNode build(WorkspaceContext workspace, String windowId, Path file, Integer startLine, Integer endLine) {
        Path absolute = file.toAbsolutePath().normalize();
        if (!Files.isRegularFile(absolute)) {
            throw new CommandException(ErrorCode.FILE_NOT_FOUND, "File not found: " + file);
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(absolute);
        } catch (IOException e) {
            throw new CommandException(ErrorCode.COMMAND_EXECUTION_ERROR, "Failed to read " + file + ": " + e.getMessage(), e);
        }
        int start = startLine == null ? 1 : startLine;
        int end = endLine == null ? Math.max(1, lines.size()) : endLine;
        if (start < 1 || end < start || (!lines.isEmpty() && end > lines.size())) {
            throw new CommandException(ErrorCode.INVALID_PAYLOAD,
                    "Invalid line range " + start + "-" + end + " for " + lines.size() + " line(s)");
        }
        String snippet = lines.isEmpty() ? "" : String.join("\n", lines.subList(start - 1, end));

        Optional<WorkspaceFolder> folder = workspace.folderFor(absolute);
        String relative = folder.map(f -> f.relativize(absolute)).orElse(absolute.toString());
        String label = relative + " (" + start + "-" + end + ")";

        ObjectNode payload = Jsons.object();
        payload.put("snippet", snippet);
        payload.put("language", WorkspaceFiles.languageId(absolute));
        payload.put("filePath", absolute.toString());
        payload.put("relativeFilePath", relative);
        payload.put("startLine", start);
        payload.put("endLine", end);
        ObjectNode metadata = payload.putObject("metadata");
        metadata.put("unique_block_id", UUID.randomUUID().toString());
        metadata.put("content_source_id", absolute.toUri() + "#L" + start + "-L" + end);
        metadata.put("type", "CodeSnippet");
        metadata.put("label", label);
        metadata.put("workspaceFolderUri", folder.map(WorkspaceFolder::uri).orElse(null));
        metadata.put("workspaceFolderName", folder.map(WorkspaceFolder::name).orElse(null));
        metadata.put("windowId", windowId);
        payload.putNull("targetTabId");
        payload.put("windowId", windowId);
        return payload;
    }
}
