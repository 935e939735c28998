package io.contextlink.client;

import io.contextlink.config.ContextLinkConfig;
import io.contextlink.util.DaemonThreads;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

public final class ConnectionSupervisor implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(ConnectionSupervisor.class);

    private final ContextLinkConfig config;
    private final ScheduledExecutorService loop;
    private final List<ConnectionStatusListener> statusListeners = new CopyOnWriteArrayList<>();
    private final LinkSocket.Events adoptedEvents = new AdoptedEvents();
    private volatile Consumer<String> frameListener = frame -> {
    };
    private volatile boolean autoReconnect = true;
    private volatile ConnectionStatus status;
    private volatile LinkSocket socket;

    // Loop-confined.
    private CompletableFuture<Void> inFlight;
    private int attempt;
    private boolean closed;
    private ScheduledFuture<?> reconnectTimer;

    public ConnectionSupervisor(ContextLinkConfig config) {
        this.config = config;
        this.loop = Executors.newSingleThreadScheduledExecutor(DaemonThreads.factory("contextlink-client-loop"));
    }

    public void onFrame(Consumer<String> listener) {
        this.frameListener = listener;
    }

    public void addStatusListener(ConnectionStatusListener listener) {
        statusListeners.add(listener);
    }

    public void autoReconnect(boolean enabled) {
        this.autoReconnect = enabled;
    }

    public boolean isConnected() {
        LinkSocket current = socket;
        return current != null && current.isOpen();
    }

    public int connectedPort() {
        LinkSocket current = socket;
        return current == null ? -1 : current.port();
    }

    public ConnectionStatus status() {
        return status;
    }

    ScheduledExecutorService loop() {
        return loop;
    }

    public CompletableFuture<Void> ensureConnected() {
        CompletableFuture<CompletableFuture<Void>> handle = new CompletableFuture<>();
        try {
            loop.execute(() -> handle.complete(ensureConnectedOnLoop()));
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(new ConnectionException("Connection supervisor is closed", e));
        }
        return handle.thenCompose(attemptFuture -> attemptFuture);
    }

    public void send(String frame) {
        LinkSocket current = socket;
        if (current == null || !current.isOpen()) {
            throw new ConnectionException("Not connected");
        }
        try {
            current.send(frame);
        } catch (RuntimeException e) {
            throw new ConnectionException("Send failed: " + e.getMessage(), e);
        }
    }

    public CompletableFuture<Void> disconnect() {
        CompletableFuture<Void> done = new CompletableFuture<>();
        try {
            loop.execute(() -> {
                disconnectOnLoop();
                done.complete(null);
            });
        } catch (RejectedExecutionException e) {
            done.complete(null);
        }
        return done;
    }

    @Override
    public void close() {
        try {
            loop.execute(() -> {
                closed = true;
                disconnectOnLoop();
                if (inFlight != null) {
                    inFlight.completeExceptionally(new ConnectionException("Connection supervisor closed"));
                    inFlight = null;
                }
            });
        } catch (RejectedExecutionException ignored) {
            return;
        }
        loop.shutdown();
        try {
            loop.awaitTermination(2, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private CompletableFuture<Void> ensureConnectedOnLoop() {
        if (closed) {
            return CompletableFuture.failedFuture(new ConnectionException("Connection supervisor is closed"));
        }
        if (isConnected()) {
            return CompletableFuture.completedFuture(null);
        }
        if (inFlight != null) {
            return inFlight;
        }
        CompletableFuture<Void> attemptFuture = new CompletableFuture<>();
        inFlight = attemptFuture;
        attempt = 0;
        cancelReconnect();
        startAttempt();
        return attemptFuture;
    }

    private void startAttempt() {
        attempt++;
        emit(ConnectionStatus.CONNECTING, "attempt " + attempt + "/" + config.maxConnectAttempts());
        PortScanner.scan(
                config.host(),
                config.portRangeStart(),
                config.portRangeEnd(),
                config.probeTimeoutMs(),
                loop,
                adoptedEvents
        ).whenCompleteAsync(this::onScanFinished, loop);
    }

    private void onScanFinished(LinkSocket winner, Throwable error) {
        if (closed) {
            if (winner != null) {
                winner.closeIntentionally();
            }
            return;
        }
        if (error == null) {
            socket = winner;
            LOG.info("Connected to {}:{}", config.host(), winner.port());
            emit(ConnectionStatus.CONNECTED, "port " + winner.port());
            completeInFlight(null);
            return;
        }
        String reason = rootMessage(error);
        LOG.warn("Connection attempt {}/{} failed: {}", attempt, config.maxConnectAttempts(), reason);
        emit(ConnectionStatus.CONNECTION_ERROR, reason);
        if (attempt < config.maxConnectAttempts()) {
            reconnectTimer = loop.schedule(this::startAttempt, config.retryDelayMs(), TimeUnit.MILLISECONDS);
            return;
        }
        LOG.error("Giving up after {} connection attempts", attempt);
        emit(ConnectionStatus.FAILED_MAX_RETRIES, reason);
        completeInFlight(new ConnectionException("Failed to connect after " + attempt + " attempts: " + reason));
    }

    private void completeInFlight(Throwable error) {
        CompletableFuture<Void> pending = inFlight;
        inFlight = null;
        reconnectTimer = null;
        if (pending == null) {
            return;
        }
        if (error == null) {
            pending.complete(null);
        } else {
            pending.completeExceptionally(error);
        }
    }

    private void disconnectOnLoop() {
        cancelReconnect();
        LinkSocket current = socket;
        socket = null;
        if (current != null) {
            LOG.info("Disconnecting from port {}", current.port());
            current.closeIntentionally();
        }
    }

    private void cancelReconnect() {
        if (reconnectTimer != null) {
            reconnectTimer.cancel(false);
            reconnectTimer = null;
        }
    }

    private void handleClose(LinkSocket closedSocket, int code, String reason) {
        if (closedSocket != socket) {
            return;
        }
        socket = null;
        if (closedSocket.intentionalClose()) {
            return;
        }
        LOG.warn("Connection to port {} closed unexpectedly (code={}, reason={})", closedSocket.port(), code, reason);
        emit(ConnectionStatus.DISCONNECTED_UNEXPECTEDLY, "code " + code);
        if (autoReconnect && !closed && inFlight == null) {
            reconnectTimer = loop.schedule(() -> {
                reconnectTimer = null;
                ensureConnectedOnLoop();
            }, config.retryDelayMs(), TimeUnit.MILLISECONDS);
        }
    }

    private void emit(ConnectionStatus next, String detail) {
        status = next;
        for (ConnectionStatusListener listener : statusListeners) {
            try {
                listener.onStatus(next, detail);
            } catch (RuntimeException e) {
                LOG.warn("Status listener failed: {}", e.getMessage());
            }
        }
    }

    private static String rootMessage(Throwable error) {
        Throwable cursor = error;
        while (cursor.getCause() != null) {
            cursor = cursor.getCause();
        }
        return cursor.getMessage() == null ? cursor.getClass().getSimpleName() : cursor.getMessage();
    }

    private void onLoop(Runnable task) {
        try {
            loop.execute(task);
        } catch (RejectedExecutionException e) {
            LOG.debug("Event after close dropped");
        }
    }

    private final class AdoptedEvents implements LinkSocket.Events {
        @Override
        public void onOpened(LinkSocket linked) {
        }

        @Override
        public void onText(LinkSocket linked, String text) {
            onLoop(() -> {
                if (linked != socket) {
                    return;
                }
                try {
                    frameListener.accept(text);
                } catch (RuntimeException e) {
                    LOG.error("Frame listener failed", e);
                }
            });
        }

        @Override
        public void onClosed(LinkSocket linked, int code, String reason, boolean remote) {
            onLoop(() -> handleClose(linked, code, reason));
        }

        @Override
        public void onFailure(LinkSocket linked, Exception error) {
            LOG.debug("Socket error on port {}: {}", linked.port(), error.getMessage());
        }
    }
}
