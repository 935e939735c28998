package io.contextlink.client;

import com.fasterxml.jackson.databind.JsonNode;
import io.contextlink.protocol.Envelope;
import io.contextlink.protocol.EnvelopeCodec;
import io.contextlink.protocol.ErrorCode;
import io.contextlink.protocol.MessageType;
import io.contextlink.protocol.Payloads;
import io.contextlink.protocol.ProtocolException;
import io.contextlink.protocol.PushKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

public final class RequestRouter {
    private static final Logger LOG = LoggerFactory.getLogger(RequestRouter.class);

    private final ConnectionSupervisor supervisor;
    private final long requestTimeoutMs;
    private final Map<String, PendingRequest> pending = new ConcurrentHashMap<>();
    private final List<PushListener> pushListeners = new CopyOnWriteArrayList<>();

    public RequestRouter(ConnectionSupervisor supervisor, long requestTimeoutMs) {
        this.supervisor = supervisor;
        this.requestTimeoutMs = requestTimeoutMs;
        supervisor.onFrame(this::onFrame);
    }

    public void addPushListener(PushListener listener) {
        pushListeners.add(listener);
    }

    public int pendingCount() {
        return pending.size();
    }

    public CompletableFuture<JsonNode> send(String command, JsonNode payload) {
        CompletableFuture<JsonNode> result = new CompletableFuture<>();
        supervisor.ensureConnected().whenComplete((ignored, error) -> {
            if (error != null || !supervisor.isConnected()) {
                String reason = error == null ? "socket not open" : unwrap(error).getMessage();
                result.completeExceptionally(new IpcClientException(
                        "Not connected: " + reason, ErrorCode.NOT_CONNECTED.name(), error));
                return;
            }
            transmit(Envelope.request(command, payload), result);
        });
        return result;
    }

    public void sendPush(PushKind kind, JsonNode payload) {
        supervisor.send(EnvelopeCodec.encode(Envelope.push(kind, payload)));
    }

    private void transmit(Envelope request, CompletableFuture<JsonNode> result) {
        PendingRequest entry = new PendingRequest(request.messageId(), request.command(), result);
        pending.put(entry.messageId(), entry);
        entry.deadline(supervisor.loop().schedule(() -> expire(entry), requestTimeoutMs, TimeUnit.MILLISECONDS));
        try {
            supervisor.send(EnvelopeCodec.encode(request));
            LOG.debug("-> request {} {}", request.command(), request.messageId());
        } catch (ConnectionException e) {
            pending.remove(entry.messageId());
            entry.reject(new IpcClientException("Not connected: " + e.getMessage(), ErrorCode.NOT_CONNECTED.name(), e));
        }
    }

    private void expire(PendingRequest entry) {
        if (pending.remove(entry.messageId(), entry)) {
            LOG.warn("Request {} ({}) timed out after {} ms", entry.messageId(), entry.command(), requestTimeoutMs);
            entry.reject(new IpcClientException(
                    "Request timed out: " + entry.command(), ErrorCode.REQUEST_TIMEOUT.name()));
        }
    }

    void onFrame(String frame) {
        Envelope envelope;
        try {
            envelope = EnvelopeCodec.decode(frame);
        } catch (ProtocolException e) {
            rejectFrame(e);
            return;
        }
        switch (envelope.type()) {
            case RESPONSE, ERROR_RESPONSE -> settle(envelope);
            case PUSH -> deliverPush(envelope);
            case REQUEST -> {
                LOG.warn("Server sent a request ({}); clients do not serve requests", envelope.command());
                reply(Envelope.error(envelope.messageId(), ErrorCode.INVALID_MESSAGE_TYPE,
                        "Client cannot handle requests."));
            }
        }
    }

    private void settle(Envelope answer) {
        PendingRequest entry = pending.remove(answer.messageId());
        if (entry == null) {
            LOG.warn("Dropping {} for unknown or expired request {}", answer.command(), answer.messageId());
            return;
        }
        JsonNode payload = answer.payload();
        if (answer.type() == MessageType.ERROR_RESPONSE || Payloads.isFailure(payload)) {
            entry.reject(new IpcClientException(Payloads.errorMessage(payload), Payloads.errorCode(payload)));
        } else {
            entry.resolve(payload);
        }
    }

    private void deliverPush(Envelope push) {
        if (PushKind.fromWire(push.command()).isEmpty()) {
            LOG.warn("Unknown push '{}' received", push.command());
        }
        for (PushListener listener : pushListeners) {
            try {
                listener.onPush(push);
            } catch (RuntimeException e) {
                LOG.error("Push listener failed for {}", push.command(), e);
            }
        }
    }

    private void rejectFrame(ProtocolException e) {
        if (e.recoveredMessageId().isEmpty()) {
            LOG.warn("Dropped malformed frame from server: {}", e.getMessage());
            return;
        }
        LOG.warn("Rejected frame {} from server: {}", e.recoveredMessageId().get(), e.getMessage());
        reply(Envelope.error(e.recoveredMessageId().get(), e.errorCode(), e.getMessage()));
    }

    private void reply(Envelope envelope) {
        try {
            supervisor.send(EnvelopeCodec.encode(envelope));
        } catch (ConnectionException e) {
            LOG.warn("Could not send {}: {}", envelope.command(), e.getMessage());
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable cursor = error;
        while (cursor instanceof CompletionException && cursor.getCause() != null) {
            cursor = cursor.getCause();
        }
        return cursor;
    }
}
