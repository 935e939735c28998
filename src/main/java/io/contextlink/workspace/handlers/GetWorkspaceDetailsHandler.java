package io.contextlink.workspace.handlers;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.contextlink.protocol.Command;
import io.contextlink.protocol.Payloads;
import io.contextlink.server.ClientRecord;
import io.contextlink.workspace.WorkspaceContext;
import io.contextlink.workspace.WorkspaceFolder;

public final class GetWorkspaceDetailsHandler extends WorkspaceHandler {
    public GetWorkspaceDetailsHandler(WorkspaceContext workspace, String windowId) {
        super(workspace, windowId);
    }

    @Override
    public Command command() {
        return Command.GET_WORKSPACE_DETAILS;
    }

    @Override
    public JsonNode handle(JsonNode payload, ClientRecord client) {
        ObjectNode data = tagged();
        ArrayNode folders = data.putArray("workspaceFolders");
        for (WorkspaceFolder folder : workspace.folders()) {
            ObjectNode item = tagged();
            item.put("uri", folder.uri());
            item.put("name", folder.name());
            folders.add(item);
        }
        data.put("isTrusted", workspace.isTrusted());
        return Payloads.ok(data);
    }
}
