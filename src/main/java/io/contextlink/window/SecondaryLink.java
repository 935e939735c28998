package io.contextlink.window;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.contextlink.client.ConnectionException;
import io.contextlink.client.ConnectionStatus;
import io.contextlink.client.ConnectionSupervisor;
import io.contextlink.client.RequestRouter;
import io.contextlink.config.ContextLinkConfig;
import io.contextlink.protocol.Command;
import io.contextlink.protocol.Envelope;
import io.contextlink.protocol.ErrorCode;
import io.contextlink.protocol.Payloads;
import io.contextlink.protocol.PushKind;
import io.contextlink.server.CommandDispatcher;
import io.contextlink.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

final class SecondaryLink implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(SecondaryLink.class);
    private static final long UNREGISTER_WAIT_MS = 1_000L;

    private final String windowId;
    private final CommandDispatcher dispatcher;
    private final ExecutorService workers;
    private final ConnectionSupervisor supervisor;
    private final RequestRouter router;
    private volatile boolean stopping;

    SecondaryLink(ContextLinkConfig config, String windowId, CommandDispatcher dispatcher, ExecutorService workers,
                  Runnable onPrimaryLost) {
        this.windowId = windowId;
        this.dispatcher = dispatcher;
        this.workers = workers;
        this.supervisor = new ConnectionSupervisor(config);
        this.router = new RequestRouter(supervisor, config.requestTimeoutMs());
        supervisor.autoReconnect(false);
        supervisor.addStatusListener((status, detail) -> {
            if (status == ConnectionStatus.DISCONNECTED_UNEXPECTEDLY && !stopping) {
                LOG.warn("Window {} lost the Primary ({})", windowId, detail);
                onPrimaryLost.run();
            }
        });
        router.addPushListener(this::onPush);
    }

    CompletableFuture<Void> start() {
        ObjectNode registration = Jsons.object();
        registration.put("windowId", windowId);
        registration.put("port", 0);
        return supervisor.ensureConnected()
                .thenCompose(ignored -> router.send(Command.REGISTER_SECONDARY.wireName(), registration))
                .thenAccept(ack -> LOG.info("Window {} registered as Secondary on port {}", windowId, supervisor.connectedPort()));
    }

    int primaryPort() {
        return supervisor.connectedPort();
    }

    boolean isConnected() {
        return supervisor.isConnected();
    }

    boolean forwardPush(ObjectNode originalPushPayload) {
        ObjectNode wrapper = Jsons.object();
        wrapper.set("originalPushPayload", originalPushPayload);
        try {
            router.sendPush(PushKind.FORWARD_PUSH_TO_PRIMARY, wrapper);
            return true;
        } catch (ConnectionException e) {
            LOG.warn("Could not forward push to Primary: {}", e.getMessage());
            return false;
        }
    }

    private void onPush(Envelope push) {
        if (PushKind.fromWire(push.command()).orElse(null) != PushKind.FORWARD_REQUEST) {
            LOG.warn("Secondary {} ignores push '{}'", windowId, push.command());
            return;
        }
        try {
            workers.execute(() -> answerForwardedRequest(push.payload()));
        } catch (RejectedExecutionException e) {
            LOG.debug("Window stopping; forwarded request dropped");
        }
    }

    private void answerForwardedRequest(JsonNode forward) {
        String aggregationId = forward.path("aggregationId").asText("");
        String originalCommand = forward.path("originalCommand").asText("");
        Optional<Command> command = Command.fromWire(originalCommand);
        JsonNode result = command.isPresent()
                ? dispatcher.execute(command.get(), forward.path("originalPayload"), null)
                : Payloads.error(ErrorCode.UNKNOWN_COMMAND, "Unknown command: " + originalCommand);
        ObjectNode answer = Jsons.object();
        answer.put("aggregationId", aggregationId);
        answer.set("responsePayload", result);
        answer.put("secondaryWindowId", windowId);
        try {
            router.sendPush(PushKind.FORWARD_RESPONSE_TO_PRIMARY, answer);
        } catch (ConnectionException e) {
            LOG.warn("Could not answer aggregation {}: {}", aggregationId, e.getMessage());
        }
    }

    @Override
    public void close() {
        stopping = true;
        if (supervisor.isConnected()) {
            ObjectNode payload = Jsons.object();
            payload.put("windowId", windowId);
            try {
                router.send(Command.UNREGISTER_SECONDARY.wireName(), payload)
                        .get(UNREGISTER_WAIT_MS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (Exception e) {
                LOG.debug("Unregister of {} not acknowledged: {}", windowId, e.getMessage());
            }
        }
        supervisor.close();
    }
}
