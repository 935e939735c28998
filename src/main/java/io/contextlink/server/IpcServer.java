package io.contextlink.server;

import org.java_websocket.WebSocket;
import org.java_websocket.handshake.ClientHandshake;
import org.java_websocket.server.WebSocketServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

public final class IpcServer extends WebSocketServer {
    private static final Logger LOG = LoggerFactory.getLogger(IpcServer.class);
    private static final long BIND_WAIT_MS = 5_000L;

    public interface Listener {
        void onOpen(PeerConnection connection);

        void onFrame(PeerConnection connection, String frame);

        void onClose(PeerConnection connection);
    }

    private final Listener listener;
    private final CountDownLatch startup = new CountDownLatch(1);
    private volatile Exception startupFailure;
    private volatile boolean started;

    private IpcServer(InetSocketAddress address, Listener listener) {
        super(address);
        this.listener = listener;
        // Windows lets a second process bind a reused address, which would defeat election.
        setReuseAddr(!System.getProperty("os.name", "").toLowerCase(Locale.ROOT).contains("win"));
    }

    public static Optional<IpcServer> tryBind(String host, int port, Listener listener) {
        IpcServer server = new IpcServer(new InetSocketAddress(host, port), listener);
        server.start();
        try {
            if (!server.startup.await(BIND_WAIT_MS, TimeUnit.MILLISECONDS)) {
                LOG.warn("Timed out binding {}:{}", host, port);
                server.shutdown();
                return Optional.empty();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            server.shutdown();
            return Optional.empty();
        }
        if (!server.started) {
            LOG.debug("Port {} unavailable: {}", port,
                    server.startupFailure == null ? "unknown" : server.startupFailure.getMessage());
            return Optional.empty();
        }
        LOG.info("Listening on {}:{}", host, server.getPort());
        return Optional.of(server);
    }

    public void shutdown() {
        try {
            stop(1_000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void onStart() {
        started = true;
        startup.countDown();
    }

    @Override
    public void onOpen(WebSocket conn, ClientHandshake handshake) {
        WebSocketPeer peer = new WebSocketPeer(conn);
        conn.setAttachment(peer);
        LOG.debug("Accepted {}", peer);
        listener.onOpen(peer);
    }

    @Override
    public void onMessage(WebSocket conn, String message) {
        PeerConnection peer = conn.getAttachment();
        if (peer != null) {
            listener.onFrame(peer, message);
        }
    }

    @Override
    public void onClose(WebSocket conn, int code, String reason, boolean remote) {
        PeerConnection peer = conn.getAttachment();
        if (peer != null) {
            LOG.debug("Closed {} code={} remote={}", peer, code, remote);
            listener.onClose(peer);
        }
    }

    @Override
    public void onError(WebSocket conn, Exception ex) {
        if (conn == null) {
            // Server-level failure; during startup this is a failed bind.
            startupFailure = ex;
            startup.countDown();
            if (started) {
                LOG.error("Server error on port {}", getPort(), ex);
            }
            return;
        }
        LOG.warn("Socket error on {}: {}", conn.getRemoteSocketAddress(), ex.getMessage());
    }
}
