package io.contextlink.push;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.contextlink.protocol.ErrorCode;
import io.contextlink.server.CommandException;
import io.contextlink.workspace.LocalWorkspace;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SnippetPushTest {
    @TempDir
    Path root;

    @Test
    void shouldCutInclusiveLineRange() throws Exception {
        Path file = Files.createDirectories(root.resolve("src")).resolve("App.java");
        Files.writeString(file, "line1\nline2\nline3\nline4\n");

        ObjectNode payload = SnippetPush.build(LocalWorkspace.of(root), "w-1", file, 2, 3);

        assertEquals("line2\nline3", payload.path("snippet").asText());
        assertEquals("java", payload.path("language").asText());
        assertEquals("src/App.java", payload.path("relativeFilePath").asText());
        assertEquals("CodeSnippet", payload.path("metadata").path("type").asText());
        assertEquals("w-1", payload.path("metadata").path("windowId").asText());
        assertTrue(payload.path("targetTabId").isNull());
    }

    @Test
    void shouldDefaultToWholeFile() throws Exception {
        Path file = root.resolve("notes.md");
        Files.writeString(file, "a\nb");

        ObjectNode payload = SnippetPush.build(LocalWorkspace.of(root), "w-1", file, null, null);

        assertEquals("a\nb", payload.path("snippet").asText());
        assertEquals(1, payload.path("startLine").asInt());
        assertEquals(2, payload.path("endLine").asInt());
    }

    @Test
    void shouldRejectMissingFilesAndBadRanges() throws Exception {
        Path file = root.resolve("one.txt");
        Files.writeString(file, "only");
        LocalWorkspace workspace = LocalWorkspace.of(root);

        CommandException missing = assertThrows(CommandException.class,
                () -> SnippetPush.build(workspace, "w-1", root.resolve("nope.txt"), null, null));
        assertEquals(ErrorCode.FILE_NOT_FOUND, missing.errorCode());

        CommandException range = assertThrows(CommandException.class,
                () -> SnippetPush.build(workspace, "w-1", file, 1, 5));
        assertEquals(ErrorCode.INVALID_PAYLOAD, range.errorCode());
    }
}
