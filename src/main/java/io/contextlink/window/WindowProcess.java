package io.contextlink.window;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.contextlink.config.ContextLinkConfig;
import io.contextlink.protocol.PushKind;
import io.contextlink.push.PushRelay;
import io.contextlink.push.SnippetPush;
import io.contextlink.server.ClientRegistry;
import io.contextlink.server.CommandDispatcher;
import io.contextlink.server.IpcServer;
import io.contextlink.server.ServerEndpoint;
import io.contextlink.util.DaemonThreads;
import io.contextlink.util.Jsons;
import io.contextlink.window.aggregation.AggregationPolicy;
import io.contextlink.window.aggregation.AggregationService;
import io.contextlink.workspace.WorkspaceContext;
import io.contextlink.workspace.handlers.WorkspaceHandlers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

public final class WindowProcess implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(WindowProcess.class);
    private static final long REELECT_MIN_DELAY_MS = 100L;
    private static final long REELECT_MAX_DELAY_MS = 600L;

    private final ContextLinkConfig config;
    private final String windowId;
    private final WorkspaceContext workspace;
    private final CommandDispatcher dispatcher;
    private final SecondaryRegistry secondaries;
    private final LeaderElection election;
    private final ScheduledExecutorService control;
    private final ScheduledExecutorService timers;
    private final ExecutorService workers;
    private final CompletableFuture<WindowRole> started = new CompletableFuture<>();

    private volatile WindowRole role = WindowRole.ELECTING;
    private volatile int port = -1;
    private volatile IpcServer server;
    private volatile ServerEndpoint endpoint;
    private volatile AggregationService aggregation;
    private volatile PushRelay relay;
    private volatile SecondaryLink link;
    private int failedRounds;

    public WindowProcess(ContextLinkConfig config, String windowId, WorkspaceContext workspace) {
        this.config = config;
        this.windowId = windowId;
        this.workspace = workspace;
        this.secondaries = new SecondaryRegistry(config.maxSecondaries());
        this.election = new LeaderElection(config);
        this.control = Executors.newSingleThreadScheduledExecutor(DaemonThreads.factory("contextlink-window"));
        this.timers = Executors.newSingleThreadScheduledExecutor(DaemonThreads.factory("contextlink-aggregation"));
        this.workers = Executors.newCachedThreadPool(DaemonThreads.factory("contextlink-forward"));
        this.dispatcher = new CommandDispatcher(workspace);
        WorkspaceHandlers.all(workspace, windowId).forEach(dispatcher::register);
        dispatcher.register(new RegisterSecondaryHandler(secondaries, () -> role == WindowRole.PRIMARY, this::secondaryGone));
        dispatcher.register(new UnregisterSecondaryHandler(secondaries, this::secondaryGone));
    }

    public CompletableFuture<WindowRole> start() {
        schedule(this::runElection, 0L);
        return started;
    }

    public String windowId() {
        return windowId;
    }

    public WindowRole role() {
        return role;
    }

    public int port() {
        return port;
    }

    public List<String> secondaryWindowIds() {
        return secondaries.windowIds();
    }

    public CommandDispatcher dispatcher() {
        return dispatcher;
    }

    public Optional<ClientRegistry> clients() {
        ServerEndpoint current = endpoint;
        return current == null ? Optional.empty() : Optional.of(current.clients());
    }

    public boolean pushSnippet(Path file, Integer startLine, Integer endLine) {
        ObjectNode payload = SnippetPush.build(workspace, windowId, file, startLine, endLine);
        WindowRole current = role;
        if (current == WindowRole.PRIMARY && relay != null) {
            return relay.deliverToActiveTab(PushKind.PUSH_SNIPPET, payload);
        }
        SecondaryLink currentLink = link;
        if (current == WindowRole.SECONDARY && currentLink != null) {
            return currentLink.forwardPush(payload);
        }
        LOG.warn("Window {} is {}; snippet not sent", windowId, current);
        return false;
    }

    public ObjectNode status() {
        ObjectNode node = Jsons.object();
        node.put("windowId", windowId);
        node.put("role", role.name());
        node.put("port", port);
        ArrayNode ids = node.putArray("secondaries");
        if (role == WindowRole.PRIMARY) {
            secondaries.windowIds().forEach(ids::add);
        }
        ServerEndpoint current = endpoint;
        node.put("clients", current == null ? 0 : current.clients().size());
        return node;
    }

    @Override
    public void close() {
        if (control.isShutdown()) {
            return;
        }
        CompletableFuture<Void> done = new CompletableFuture<>();
        try {
            control.execute(() -> {
                role = WindowRole.STOPPED;
                tearDown();
                done.complete(null);
            });
            done.get(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            LOG.warn("Window {} did not stop cleanly: {}", windowId, e.getMessage());
        }
        control.shutdownNow();
        timers.shutdownNow();
        workers.shutdownNow();
        if (!started.isDone()) {
            started.completeExceptionally(new IllegalStateException("Window stopped before election finished"));
        }
        LOG.info("Window {} stopped", windowId);
    }

    private void secondaryGone(String secondaryWindowId) {
        AggregationService current = aggregation;
        if (current != null) {
            current.windowGone(secondaryWindowId);
        }
    }

    private void runElection() {
        if (role == WindowRole.STOPPED) {
            return;
        }
        role = WindowRole.ELECTING;
        port = -1;
        secondaries.clear();
        ClientRegistry clients = new ClientRegistry();
        PushRelay termRelay = new PushRelay(clients);
        AggregationService termAggregation = new AggregationService(config.aggregationTimeoutMs(), timers,
                AggregationPolicy.defaults());
        ServerEndpoint termEndpoint = new ServerEndpoint(clients, dispatcher,
                new PrimaryCoordinator(windowId, workspace, dispatcher, secondaries, termAggregation, termRelay));

        Optional<LeaderElection.Outcome> outcome = election.elect(termEndpoint);
        if (outcome.isEmpty()) {
            termEndpoint.close();
            retryElection("no port available and no Primary reachable");
            return;
        }
        if (outcome.get().role() == WindowRole.PRIMARY) {
            server = outcome.get().server();
            endpoint = termEndpoint;
            aggregation = termAggregation;
            relay = termRelay;
            port = outcome.get().port();
            failedRounds = 0;
            role = WindowRole.PRIMARY;
            LOG.info("Window {} is Primary on port {}", windowId, port);
            started.complete(WindowRole.PRIMARY);
            return;
        }
        termEndpoint.close();
        becomeSecondary();
    }

    private void becomeSecondary() {
        SecondaryLink candidate = new SecondaryLink(config, windowId, dispatcher, workers, this::onPrimaryLost);
        link = candidate;
        CompletableFuture<Void> registered;
        try {
            registered = candidate.start();
        } catch (RuntimeException e) {
            registered = CompletableFuture.failedFuture(e);
        }
        registered.whenComplete((ignored, error) -> execute(() -> {
            if (link != candidate || role == WindowRole.STOPPED) {
                return;
            }
            if (error != null) {
                link = null;
                candidate.close();
                retryElection("registration with Primary failed: " + error.getMessage());
                return;
            }
            port = candidate.primaryPort();
            failedRounds = 0;
            role = WindowRole.SECONDARY;
            LOG.info("Window {} is Secondary of port {}", windowId, port);
            started.complete(WindowRole.SECONDARY);
        }));
    }

    private void onPrimaryLost() {
        long delay = ThreadLocalRandom.current().nextLong(REELECT_MIN_DELAY_MS, REELECT_MAX_DELAY_MS);
        schedule(() -> {
            if (role == WindowRole.STOPPED) {
                return;
            }
            SecondaryLink lost = link;
            link = null;
            if (lost != null) {
                lost.close();
            }
            LOG.info("Window {} re-running election", windowId);
            runElection();
        }, delay);
    }

    private void retryElection(String reason) {
        failedRounds++;
        if (failedRounds >= config.maxConnectAttempts()) {
            LOG.error("Window {} election failed after {} rounds: {}", windowId, failedRounds, reason);
            role = WindowRole.STOPPED;
            started.completeExceptionally(new IllegalStateException("Election failed: " + reason));
            return;
        }
        LOG.warn("Window {} election round {} failed: {}; retrying", windowId, failedRounds, reason);
        role = WindowRole.ELECTING;
        schedule(this::runElection, config.retryDelayMs());
    }

    private void tearDown() {
        SecondaryLink currentLink = link;
        link = null;
        if (currentLink != null) {
            currentLink.close();
        }
        IpcServer currentServer = server;
        server = null;
        if (currentServer != null) {
            currentServer.shutdown();
        }
        ServerEndpoint currentEndpoint = endpoint;
        endpoint = null;
        if (currentEndpoint != null) {
            currentEndpoint.close();
        }
        AggregationService currentAggregation = aggregation;
        aggregation = null;
        if (currentAggregation != null) {
            currentAggregation.close();
        }
        relay = null;
        secondaries.clear();
        port = -1;
    }

    private void schedule(Runnable task, long delayMs) {
        try {
            control.schedule(guarded(task), delayMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            LOG.debug("Window {} stopped; task dropped", windowId);
        }
    }

    private void execute(Runnable task) {
        schedule(task, 0L);
    }

    private Runnable guarded(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                LOG.error("Window {} control task failed", windowId, e);
            }
        };
    }
}
