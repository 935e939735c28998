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

import java.nio.file.Files;
import java.util.Locale;

public final class SearchWorkspaceHandler extends WorkspaceHandler {
    public static final int MAX_RESULTS = 200;

    public SearchWorkspaceHandler(WorkspaceContext workspace, String windowId) {
        super(workspace, windowId);
    }

    @Override
    public Command command() {
        return Command.SEARCH_WORKSPACE;
    }

    @Override
    public JsonNode handle(JsonNode payload, ClientRecord client) {
        String query = requireText(payload, "query").toLowerCase(Locale.ROOT);
        ObjectNode data = tagged();
        ArrayNode results = data.putArray("results");
        for (WorkspaceFolder folder : selectFolders(payload)) {
            if (results.size() >= MAX_RESULTS) {
                break;
            }
            WorkspaceFiles.walk(folder.root(), path -> {
                String name = fileName(path).toString();
                if (name.toLowerCase(Locale.ROOT).contains(query)) {
                    ObjectNode item = tagged();
                    item.put("path", folder.relativize(path));
                    item.put("name", name);
                    item.put("type", Files.isDirectory(path) ? "folder" : "file");
                    item.put("uri", path.toUri().toString());
                    item.put("content_source_id", path.toUri().toString());
                    item.put("workspaceFolderUri", folder.uri());
                    item.put("workspaceFolderName", folder.name());
                    results.add(item);
                }
                return results.size() < MAX_RESULTS;
            });
        }
        return Payloads.ok(data);
    }
}
