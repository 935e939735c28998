package io.contextlink.workspace;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

public interface WorkspaceContext {
    boolean isOpen();

    boolean isTrusted();

    default boolean isTrustedAndOpen() {
        return isOpen() && isTrusted();
    }

    List<WorkspaceFolder> folders();

    List<Path> openFiles();

    Optional<Path> activeFile();

    default Optional<WorkspaceFolder> folderFor(Path path) {
        for (WorkspaceFolder folder : folders()) {
            if (folder.contains(path)) {
                return Optional.of(folder);
            }
        }
        return Optional.empty();
    }

    default Optional<WorkspaceFolder> folderByUri(String uri) {
        if (uri == null || uri.isBlank()) {
            return Optional.empty();
        }
        for (WorkspaceFolder folder : folders()) {
            if (folder.uri().equals(uri)) {
                return Optional.of(folder);
            }
        }
        return Optional.empty();
    }
}
