package io.contextlink.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.contextlink.client.ContextLinkClient;
import io.contextlink.client.IpcClientException;
import io.contextlink.config.ContextLinkConfig;
import io.contextlink.server.CommandException;
import io.contextlink.util.Jsons;
import io.contextlink.window.WindowProcess;
import io.contextlink.workspace.LocalWorkspace;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@Command(
        name = "contextlink",
        mixinStandardHelpOptions = true,
        description = "Workspace IPC across editor windows",
        subcommands = {
                ContextLinkCommand.ServeCommand.class,
                ContextLinkCommand.RequestCommand.class,
                ContextLinkCommand.WatchCommand.class
        }
)
public final class ContextLinkCommand implements Runnable {
    @Option(names = {"--host"}, description = "Loopback host to bind and probe")
    String host;

    @Option(names = {"--port-start"}, description = "First port of the shared range")
    Integer portStart;

    @Option(names = {"--port-end"}, description = "Last port of the shared range")
    Integer portEnd;

    @Option(names = {"--request-timeout-ms"}, description = "Per-request timeout")
    Long requestTimeoutMs;

    @Override
    public void run() {
        System.out.println("Use subcommands: serve | request | watch");
    }

    ContextLinkConfig config() {
        ContextLinkConfig loaded = ContextLinkConfig.load();
        ContextLinkConfig config = new ContextLinkConfig(
                host == null ? loaded.host() : host,
                portStart == null ? loaded.portRangeStart() : portStart,
                portEnd == null ? loaded.portRangeEnd() : portEnd,
                loaded.maxConnectAttempts(),
                loaded.retryDelayMs(),
                loaded.requestTimeoutMs(),
                loaded.probeTimeoutMs(),
                loaded.aggregationTimeoutMs(),
                loaded.maxSecondaries()
        );
        return requestTimeoutMs == null ? config : config.withRequestTimeoutMs(requestTimeoutMs);
    }

    @Command(name = "serve", description = "Run one editor window: elect, then serve or link to the Primary")
    static final class ServeCommand implements Callable<Integer> {
        @ParentCommand
        ContextLinkCommand parent;

        @Option(names = {"--workspace"}, required = true, description = "Workspace folder (repeatable)")
        List<Path> workspaceFolders = new ArrayList<>();

        @Option(names = {"--window-id"}, description = "Window id (default: random)")
        String windowId;

        @Option(names = {"--open"}, description = "File to mark open; the last one is active (repeatable)")
        List<Path> openFiles = new ArrayList<>();

        @Option(names = {"--untrusted"}, description = "Open the workspace untrusted")
        boolean untrusted;

        @Override
        public Integer call() throws Exception {
            LocalWorkspace workspace = new LocalWorkspace(workspaceFolders, !untrusted);
            openFiles.forEach(workspace::open);
            String id = windowId == null || windowId.isBlank() ? UUID.randomUUID().toString() : windowId;
            try (WindowProcess window = new WindowProcess(parent.config(), id, workspace)) {
                try {
                    window.start().get();
                } catch (ExecutionException e) {
                    System.err.println("Election failed: " + e.getCause().getMessage());
                    return 1;
                }
                System.out.println(Jsons.toJson(window.status()));
                runConsole(window);
            }
            return 0;
        }

        private void runConsole(WindowProcess window) throws IOException {
            BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
            String line;
            while ((line = in.readLine()) != null) {
                ConsoleCommandParser.ConsoleCommand command = ConsoleCommandParser.parse(line);
                if (command.op().isEmpty()) {
                    continue;
                }
                if (ConsoleCommandParser.isQuit(command.op())) {
                    return;
                }
                switch (command.op()) {
                    case "status" -> System.out.println(Jsons.toPrettyJson(window.status()));
                    case "snippet" -> pushSnippet(window, command);
                    default -> System.out.println("Commands: snippet <file> [start end] | status | quit");
                }
            }
        }

        private void pushSnippet(WindowProcess window, ConsoleCommandParser.ConsoleCommand command) {
            try {
                ConsoleCommandParser.SnippetRequest request = ConsoleCommandParser.snippet(command);
                boolean sent = window.pushSnippet(Path.of(request.file()), request.startLine(), request.endLine());
                System.out.println(sent ? "snippet sent" : "snippet not delivered (see log)");
            } catch (IllegalArgumentException | CommandException e) {
                System.out.println("error: " + e.getMessage());
            }
        }
    }

    @Command(name = "request", description = "Send one request and print the response payload")
    static final class RequestCommand implements Callable<Integer> {
        @ParentCommand
        ContextLinkCommand parent;

        @Parameters(index = "0", description = "Command name, e.g. search_workspace")
        String command;

        @Option(names = {"--payload"}, defaultValue = "{}", description = "JSON payload")
        String payload;

        @Override
        public Integer call() throws Exception {
            JsonNode body = Jsons.parse(payload);
            ContextLinkConfig config = parent.config();
            try (ContextLinkClient client = new ContextLinkClient(config)) {
                JsonNode response = client.request(command, body).get(overallBudgetMs(config), TimeUnit.MILLISECONDS);
                System.out.println(Jsons.toPrettyJson(response));
                return 0;
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof IpcClientException rejected) {
                    System.err.println(rejected.errorCode() + ": " + rejected.getMessage());
                    return 2;
                }
                throw e;
            } catch (TimeoutException e) {
                System.err.println("No answer within " + overallBudgetMs(config) + " ms");
                return 2;
            }
        }

        private static long overallBudgetMs(ContextLinkConfig config) {
            long connectBudget = config.maxConnectAttempts() * (config.retryDelayMs() + config.probeTimeoutMs());
            return connectBudget + config.requestTimeoutMs();
        }
    }

    @Command(name = "watch", description = "Connect and print incoming pushes until interrupted")
    static final class WatchCommand implements Callable<Integer> {
        @ParentCommand
        ContextLinkCommand parent;

        @Option(names = {"--tab-id"}, description = "Register as the active target tab with this id")
        String tabId;

        @Override
        public Integer call() throws Exception {
            CountDownLatch stop = new CountDownLatch(1);
            try (ContextLinkClient client = new ContextLinkClient(parent.config())) {
                client.onPush(push -> System.out.println(Jsons.toJson(push.payload())));
                client.onStatus((status, detail) -> System.err.println("[" + status + "] " + detail));
                client.connect().get();
                if (tabId != null && !tabId.isBlank()) {
                    client.registerActiveTarget(tabId, "cli").get();
                }
                Runtime.getRuntime().addShutdownHook(new Thread(stop::countDown));
                stop.await();
            }
            return 0;
        }
    }
}
