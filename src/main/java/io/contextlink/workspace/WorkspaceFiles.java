package io.contextlink.workspace;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

public final class WorkspaceFiles {
    public static final Set<String> IGNORED_NAMES = Set.of(".git", "node_modules", "target", "build");
    public static final long MAX_FILE_BYTES = 1024L * 1024L;
    private static final int BINARY_SNIFF_BYTES = 8_192;

    private static final Map<String, String> LANGUAGES = Map.ofEntries(
            Map.entry("java", "java"),
            Map.entry("kt", "kotlin"),
            Map.entry("js", "javascript"),
            Map.entry("jsx", "javascriptreact"),
            Map.entry("ts", "typescript"),
            Map.entry("tsx", "typescriptreact"),
            Map.entry("py", "python"),
            Map.entry("go", "go"),
            Map.entry("rs", "rust"),
            Map.entry("c", "c"),
            Map.entry("h", "c"),
            Map.entry("cpp", "cpp"),
            Map.entry("cs", "csharp"),
            Map.entry("rb", "ruby"),
            Map.entry("json", "json"),
            Map.entry("xml", "xml"),
            Map.entry("yml", "yaml"),
            Map.entry("yaml", "yaml"),
            Map.entry("md", "markdown"),
            Map.entry("html", "html"),
            Map.entry("css", "css"),
            Map.entry("sh", "shellscript"),
            Map.entry("sql", "sql"),
            Map.entry("properties", "properties")
    );

    private WorkspaceFiles() {
    }

    public static boolean isIgnored(Path path) {
        Path name = path.getFileName();
        if (name == null) {
            return false;
        }
        String value = name.toString();
        return value.startsWith(".") || IGNORED_NAMES.contains(value);
    }

    public static void walk(Path root, Predicate<Path> visitor) {
        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (dir.equals(root)) {
                        return FileVisitResult.CONTINUE;
                    }
                    if (isIgnored(dir)) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return visitor.test(dir) ? FileVisitResult.CONTINUE : FileVisitResult.TERMINATE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (isIgnored(file)) {
                        return FileVisitResult.CONTINUE;
                    }
                    return visitor.test(file) ? FileVisitResult.CONTINUE : FileVisitResult.TERMINATE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to walk " + root, e);
        }
    }

    public static List<Path> textFiles(Path root, int limit) {
        List<Path> out = new ArrayList<>();
        walk(root, path -> {
            if (Files.isRegularFile(path) && isReadableText(path)) {
                out.add(path);
            }
            return out.size() < limit;
        });
        return out;
    }

    public static boolean isReadableText(Path file) {
        try {
            if (Files.size(file) > MAX_FILE_BYTES) {
                return false;
            }
            try (InputStream in = Files.newInputStream(file)) {
                byte[] head = in.readNBytes(BINARY_SNIFF_BYTES);
                for (byte b : head) {
                    if (b == 0) {
                        return false;
                    }
                }
            }
            return true;
        } catch (IOException e) {
            return false;
        }
    }

    public static String read(Path file) throws IOException {
        return Files.readString(file, StandardCharsets.UTF_8);
    }

    public static String languageId(Path file) {
        Path name = file.getFileName();
        String value = name == null ? "" : name.toString();
        int dot = value.lastIndexOf('.');
        if (dot < 0 || dot == value.length() - 1) {
            return "plaintext";
        }
        return LANGUAGES.getOrDefault(value.substring(dot + 1).toLowerCase(Locale.ROOT), "plaintext");
    }

    public static Path toPath(String pathOrUri, Path base) {
        if (pathOrUri.startsWith("file:")) {
            return Path.of(URI.create(pathOrUri)).toAbsolutePath().normalize();
        }
        Path path = Path.of(pathOrUri);
        if (!path.isAbsolute() && base != null) {
            path = base.resolve(path);
        }
        return path.toAbsolutePath().normalize();
    }
}
