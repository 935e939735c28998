package io.contextlink.workspace;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

public final class LocalWorkspace implements WorkspaceContext {
    private final List<WorkspaceFolder> folders;
    private final boolean trusted;
    private final List<Path> openFiles = new CopyOnWriteArrayList<>();
    private volatile Path activeFile;

    public LocalWorkspace(List<Path> roots, boolean trusted) {
        List<WorkspaceFolder> out = new ArrayList<>();
        for (Path root : roots) {
            if (!Files.isDirectory(root)) {
                throw new IllegalArgumentException("Workspace folder is not a directory: " + root);
            }
            out.add(WorkspaceFolder.of(root));
        }
        this.folders = List.copyOf(out);
        this.trusted = trusted;
    }

    public static LocalWorkspace of(Path root) {
        return new LocalWorkspace(List.of(root), true);
    }

    public static LocalWorkspace empty() {
        return new LocalWorkspace(List.of(), true);
    }

    public void open(Path file) {
        Path normalized = file.toAbsolutePath().normalize();
        if (!openFiles.contains(normalized)) {
            openFiles.add(normalized);
        }
        activeFile = normalized;
    }

    public void close(Path file) {
        Path normalized = file.toAbsolutePath().normalize();
        openFiles.remove(normalized);
        if (normalized.equals(activeFile)) {
            activeFile = openFiles.isEmpty() ? null : openFiles.get(openFiles.size() - 1);
        }
    }

    @Override
    public boolean isOpen() {
        return !folders.isEmpty();
    }

    @Override
    public boolean isTrusted() {
        return trusted;
    }

    @Override
    public List<WorkspaceFolder> folders() {
        return folders;
    }

    @Override
    public List<Path> openFiles() {
        return List.copyOf(openFiles);
    }

    @Override
    public Optional<Path> activeFile() {
        return Optional.ofNullable(activeFile);
    }
}
