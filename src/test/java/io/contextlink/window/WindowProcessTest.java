package io.contextlink.window;

import com.fasterxml.jackson.databind.JsonNode;
import io.contextlink.TestSupport;
import io.contextlink.client.ContextLinkClient;
import io.contextlink.config.ContextLinkConfig;
import io.contextlink.protocol.Command;
import io.contextlink.protocol.Envelope;
import io.contextlink.workspace.LocalWorkspace;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WindowProcessTest {
    @TempDir
    Path temp;

    private final List<AutoCloseable> cleanup = new ArrayList<>();

    @AfterEach
    void tearDown() throws Exception {
        for (AutoCloseable closeable : cleanup) {
            closeable.close();
        }
    }

    private WindowProcess window(ContextLinkConfig config, String windowId) throws IOException {
        Path root = Files.createDirectories(temp.resolve(windowId));
        Files.writeString(root.resolve("shared-" + windowId + ".txt"), windowId + "\n");
        WindowProcess window = new WindowProcess(config, windowId, LocalWorkspace.of(root));
        cleanup.add(window);
        return window;
    }

    private WindowRole started(WindowProcess window) throws Exception {
        return window.start().get(15, TimeUnit.SECONDS);
    }

    private ContextLinkClient client(ContextLinkConfig config) {
        ContextLinkClient client = new ContextLinkClient(config);
        cleanup.add(0, client);
        return client;
    }

    @Test
    void loneWindowShouldServeRequestsAsPrimary() throws Exception {
        ContextLinkConfig config = TestSupport.fastConfig(3);
        WindowProcess primary = window(config, "w-1");

        assertEquals(WindowRole.PRIMARY, started(primary));
        assertEquals(config.portRangeStart(), primary.port());

        JsonNode result = client(config).searchWorkspace("shared").get(10, TimeUnit.SECONDS);
        JsonNode results = result.path("data").path("results");
        assertEquals(1, results.size());
        assertEquals("w-1", results.get(0).path("windowId").asText());
    }

    @Test
    void secondWindowShouldRegisterAsSecondary() throws Exception {
        ContextLinkConfig config = TestSupport.fastConfig(3);
        WindowProcess primary = window(config, "w-1");
        WindowProcess secondary = window(config, "w-2");

        assertEquals(WindowRole.PRIMARY, started(primary));
        assertEquals(WindowRole.SECONDARY, started(secondary));

        assertEquals(primary.port(), secondary.port());
        assertTrue(TestSupport.await(() -> primary.secondaryWindowIds().contains("w-2"), 5_000L));
        assertEquals("SECONDARY", secondary.status().path("role").asText());
    }

    @Test
    void concurrentStartShouldElectExactlyOnePrimary() throws Exception {
        ContextLinkConfig config = TestSupport.fastConfig(3);
        WindowProcess first = window(config, "w-1");
        WindowProcess second = window(config, "w-2");
        CompletableFuture<WindowRole> a = first.start();
        CompletableFuture<WindowRole> b = second.start();

        List<WindowRole> roles = List.of(a.get(15, TimeUnit.SECONDS), b.get(15, TimeUnit.SECONDS));

        assertEquals(1, roles.stream().filter(role -> role == WindowRole.PRIMARY).count());
        assertEquals(1, roles.stream().filter(role -> role == WindowRole.SECONDARY).count());
    }

    @Test
    void aggregatedSearchShouldCoverEveryWindow() throws Exception {
        ContextLinkConfig config = TestSupport.fastConfig(3);
        WindowProcess primary = window(config, "w-1");
        started(primary);
        started(window(config, "w-2"));
        started(window(config, "w-3"));
        assertTrue(TestSupport.await(() -> primary.secondaryWindowIds().size() == 2, 5_000L));

        JsonNode result = client(config).searchWorkspace("shared").get(10, TimeUnit.SECONDS);

        Set<String> windows = new TreeSet<>();
        for (JsonNode item : result.path("data").path("results")) {
            windows.add(item.path("windowId").asText());
        }
        assertEquals(Set.of("w-1", "w-2", "w-3"), windows);
    }

    @Test
    void nonAggregatedCommandShouldStayLocal() throws Exception {
        ContextLinkConfig config = TestSupport.fastConfig(3);
        WindowProcess primary = window(config, "w-1");
        started(primary);
        started(window(config, "w-2"));
        assertTrue(TestSupport.await(() -> primary.secondaryWindowIds().size() == 1, 5_000L));

        JsonNode tree = client(config).request(Command.GET_FILE_TREE, null).get(10, TimeUnit.SECONDS);

        assertEquals("w-1", tree.path("data").path("windowId").asText());
        assertTrue(tree.path("data").path("fileTreeString").asText().contains("shared-w-1.txt"));
    }

    @Test
    void secondaryShouldTakeOverWhenPrimaryCloses() throws Exception {
        ContextLinkConfig config = TestSupport.fastConfig(3);
        WindowProcess primary = window(config, "w-1");
        WindowProcess secondary = window(config, "w-2");
        started(primary);
        started(secondary);

        primary.close();

        assertTrue(TestSupport.await(() -> secondary.role() == WindowRole.PRIMARY, 10_000L));
        JsonNode result = client(config).searchWorkspace("shared").get(10, TimeUnit.SECONDS);
        assertEquals("w-2", result.path("data").path("results").get(0).path("windowId").asText());
    }

    @Test
    void snippetFromSecondaryShouldReachTheActiveTab() throws Exception {
        ContextLinkConfig config = TestSupport.fastConfig(3);
        WindowProcess primary = window(config, "w-1");
        WindowProcess secondary = window(config, "w-2");
        started(primary);
        started(secondary);
        assertTrue(TestSupport.await(() -> primary.secondaryWindowIds().contains("w-2"), 5_000L));

        ContextLinkClient browser = client(config);
        List<Envelope> pushes = new CopyOnWriteArrayList<>();
        browser.onPush(pushes::add);
        browser.registerActiveTarget("tab-42", "chat.example").get(10, TimeUnit.SECONDS);

        assertTrue(secondary.pushSnippet(temp.resolve("w-2").resolve("shared-w-2.txt"), null, null));

        assertTrue(TestSupport.await(() -> !pushes.isEmpty(), 5_000L));
        Envelope push = pushes.get(0);
        assertEquals("push_snippet", push.command());
        assertEquals("tab-42", push.payload().path("targetTabId").asText());
        assertEquals("w-2", push.payload().path("metadata").path("windowId").asText());
        assertEquals("w-2", push.payload().path("snippet").asText());
    }

    @Test
    void snippetWithoutActiveTabShouldBeDroppedQuietly() throws Exception {
        ContextLinkConfig config = TestSupport.fastConfig(3);
        WindowProcess primary = window(config, "w-1");
        started(primary);

        boolean delivered = primary.pushSnippet(temp.resolve("w-1").resolve("shared-w-1.txt"), 1, 1);

        assertFalse(delivered);
        assertEquals(WindowRole.PRIMARY, primary.role());
    }
}
