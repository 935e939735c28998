package io.contextlink.workspace;

import java.nio.file.Path;

public record WorkspaceFolder(String uri, String name, Path root) {
    public static WorkspaceFolder of(Path root) {
        Path absolute = root.toAbsolutePath().normalize();
        Path fileName = absolute.getFileName();
        return new WorkspaceFolder(absolute.toUri().toString(), fileName == null ? absolute.toString() : fileName.toString(), absolute);
    }

    public boolean contains(Path path) {
        return path.toAbsolutePath().normalize().startsWith(root);
    }

    public String relativize(Path path) {
        return root.relativize(path.toAbsolutePath().normalize()).toString().replace('\\', '/');
    }
}
