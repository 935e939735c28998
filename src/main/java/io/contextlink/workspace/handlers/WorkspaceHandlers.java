package io.contextlink.workspace.handlers;

import io.contextlink.server.CommandHandler;
import io.contextlink.workspace.WorkspaceContext;

import java.util.List;

public final class WorkspaceHandlers {
    private WorkspaceHandlers() {
    }

    public static List<CommandHandler> all(WorkspaceContext workspace, String windowId) {
        return List.of(
                new RegisterActiveTargetHandler(),
                new GetWorkspaceDetailsHandler(workspace, windowId),
                new SearchWorkspaceHandler(workspace, windowId),
                new GetOpenFilesHandler(workspace, windowId),
                new GetActiveFileInfoHandler(workspace, windowId),
                new GetFileContentHandler(workspace, windowId),
                new GetContentsForFilesHandler(workspace, windowId),
                new GetFolderContentHandler(workspace, windowId),
                new ListFolderContentsHandler(workspace, windowId),
                new GetFileTreeHandler(workspace, windowId),
                new GetEntireCodebaseHandler(workspace, windowId)
        );
    }
}
