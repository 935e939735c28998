package io.contextlink.server;

import io.contextlink.protocol.Envelope;
import io.contextlink.protocol.EnvelopeCodec;
import io.contextlink.protocol.ProtocolException;
import io.contextlink.util.DaemonThreads;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;

public final class ServerEndpoint implements IpcServer.Listener, AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(ServerEndpoint.class);

    private final ClientRegistry clients;
    private final CommandDispatcher dispatcher;
    private final ServerHooks hooks;
    private final ExecutorService workers;

    public ServerEndpoint(ClientRegistry clients, CommandDispatcher dispatcher, ServerHooks hooks) {
        this.clients = clients;
        this.dispatcher = dispatcher;
        this.hooks = hooks == null ? ServerHooks.LOCAL_ONLY : hooks;
        this.workers = Executors.newCachedThreadPool(DaemonThreads.factory("contextlink-worker"));
    }

    public ClientRegistry clients() {
        return clients;
    }

    @Override
    public void onOpen(PeerConnection connection) {
        ClientRecord record = clients.add(connection);
        LOG.info("Client connected: {} ({} total)", record.remoteAddress(), clients.size());
    }

    @Override
    public void onFrame(PeerConnection connection, String frame) {
        Optional<ClientRecord> client = clients.find(connection);
        if (client.isEmpty()) {
            LOG.warn("Frame from unknown connection {} dropped", connection.id());
            return;
        }
        Envelope envelope;
        try {
            envelope = EnvelopeCodec.decode(frame);
        } catch (ProtocolException e) {
            rejectFrame(client.get(), e);
            return;
        }
        LOG.debug("<- {} {} {}", envelope.type().wireName(), envelope.command(), envelope.messageId());
        switch (envelope.type()) {
            case REQUEST -> submit(() -> handleRequest(envelope, client.get()));
            case PUSH -> submit(() -> hooks.onPush(envelope, client.get()));
            default -> LOG.warn("Unexpected {} '{}' from {} dropped",
                    envelope.type().wireName(), envelope.command(), client.get().id());
        }
    }

    @Override
    public void onClose(PeerConnection connection) {
        clients.remove(connection).ifPresent(record -> {
            LOG.info("Client disconnected: {} ({} remaining)", record.remoteAddress(), clients.size());
            submit(() -> hooks.onDisconnect(record));
        });
    }

    private void handleRequest(Envelope request, ClientRecord client) {
        if (hooks.interceptRequest(request, client)) {
            return;
        }
        reply(client, dispatcher.dispatch(request, client));
    }

    private void rejectFrame(ClientRecord client, ProtocolException e) {
        if (e.recoveredMessageId().isEmpty()) {
            LOG.warn("Dropped malformed frame from {}: {}", client.remoteAddress(), e.getMessage());
            return;
        }
        LOG.warn("Rejected frame {} from {}: {} {}", e.recoveredMessageId().get(), client.remoteAddress(),
                e.errorCode(), e.getMessage());
        reply(client, Envelope.error(e.recoveredMessageId().get(), e.errorCode(), e.getMessage()));
    }

    public static void reply(ClientRecord client, Envelope envelope) {
        if (!client.connection().isOpen()) {
            LOG.warn("Connection {} closed before {} could be sent", client.id(), envelope.command());
            return;
        }
        try {
            client.send(envelope);
        } catch (RuntimeException e) {
            LOG.warn("Failed to send {} to {}: {}", envelope.command(), client.id(), e.getMessage());
        }
    }

    private void submit(Runnable task) {
        try {
            workers.execute(() -> {
                try {
                    task.run();
                } catch (RuntimeException e) {
                    LOG.error("Unhandled error while processing frame", e);
                }
            });
        } catch (RejectedExecutionException e) {
            LOG.debug("Endpoint closed, task dropped");
        }
    }

    @Override
    public void close() {
        workers.shutdownNow();
    }
}
