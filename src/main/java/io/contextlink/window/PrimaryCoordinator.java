package io.contextlink.window;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.contextlink.protocol.Command;
import io.contextlink.protocol.Envelope;
import io.contextlink.protocol.MessageType;
import io.contextlink.protocol.PushKind;
import io.contextlink.push.PushRelay;
import io.contextlink.server.ClientRecord;
import io.contextlink.server.CommandDispatcher;
import io.contextlink.server.ServerHooks;
import io.contextlink.util.Jsons;
import io.contextlink.window.aggregation.AggregationContext;
import io.contextlink.window.aggregation.AggregationService;
import io.contextlink.workspace.WorkspaceContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

final class PrimaryCoordinator implements ServerHooks {
    private static final Logger LOG = LoggerFactory.getLogger(PrimaryCoordinator.class);

    private final String windowId;
    private final WorkspaceContext workspace;
    private final CommandDispatcher dispatcher;
    private final SecondaryRegistry secondaries;
    private final AggregationService aggregation;
    private final PushRelay relay;

    PrimaryCoordinator(String windowId, WorkspaceContext workspace, CommandDispatcher dispatcher,
                       SecondaryRegistry secondaries, AggregationService aggregation, PushRelay relay) {
        this.windowId = windowId;
        this.workspace = workspace;
        this.dispatcher = dispatcher;
        this.secondaries = secondaries;
        this.aggregation = aggregation;
        this.relay = relay;
    }

    @Override
    public boolean interceptRequest(Envelope request, ClientRecord client) {
        if (request.type() != MessageType.REQUEST) {
            return false;
        }
        Optional<Command> command = Command.fromWire(request.command());
        if (command.isEmpty() || !command.get().aggregated() || !dispatcher.supports(command.get())) {
            return false;
        }
        List<SecondaryRegistration> targets = secondaries.snapshot();
        if (targets.isEmpty() || (command.get().requiresWorkspace() && !workspace.isTrustedAndOpen())) {
            // Executed locally: no fan-out, or the gate rejects it before anything is forwarded.
            return false;
        }
        List<String> expected = new ArrayList<>();
        for (SecondaryRegistration target : targets) {
            expected.add(target.windowId());
        }
        AggregationContext context = aggregation.begin(request.messageId(), client, command.get(), expected);

        ObjectNode forward = Jsons.object();
        forward.put("aggregationId", context.aggregationId());
        forward.put("originalCommand", command.get().wireName());
        forward.set("originalPayload", request.payload());
        Envelope push = Envelope.push(PushKind.FORWARD_REQUEST, forward);
        for (SecondaryRegistration target : targets) {
            try {
                target.client().send(push);
            } catch (RuntimeException e) {
                LOG.warn("Could not forward {} to window {}: {}", command.get().wireName(), target.windowId(), e.getMessage());
                aggregation.dropWindow(context, target.windowId());
            }
        }
        aggregation.contributeLocal(context, windowId, dispatcher.execute(command.get(), request.payload(), client));
        return true;
    }

    @Override
    public void onPush(Envelope push, ClientRecord client) {
        Optional<PushKind> kind = PushKind.fromWire(push.command());
        if (kind.isEmpty()) {
            LOG.warn("Unknown push '{}' from {} dropped", push.command(), client.id());
            return;
        }
        switch (kind.get()) {
            case FORWARD_RESPONSE_TO_PRIMARY -> acceptForwardedResponse(push.payload(), client);
            case FORWARD_PUSH_TO_PRIMARY -> relayForwardedPush(push.payload(), client);
            default -> LOG.warn("Push '{}' is not accepted by a Primary; dropped", push.command());
        }
    }

    @Override
    public void onDisconnect(ClientRecord client) {
        secondaries.removeByClient(client).ifPresent(registration -> {
            LOG.info("Secondary {} disconnected", registration.windowId());
            aggregation.windowGone(registration.windowId());
        });
    }

    private void acceptForwardedResponse(JsonNode payload, ClientRecord client) {
        String aggregationId = payload.path("aggregationId").asText("");
        Optional<String> sender = client.windowId();
        if (sender.isEmpty()) {
            LOG.warn("Forwarded response from unregistered connection {} dropped (claimed window {})",
                    client.id(), payload.path("secondaryWindowId").asText("?"));
            return;
        }
        aggregation.accept(aggregationId, sender.get(), payload.path("responsePayload"));
    }

    private void relayForwardedPush(JsonNode payload, ClientRecord client) {
        JsonNode original = payload.path("originalPushPayload");
        if (!original.isObject()) {
            LOG.warn("Forwarded push from {} has no originalPushPayload; dropped", client.id());
            return;
        }
        relay.deliverToActiveTab(PushKind.PUSH_SNIPPET, ((ObjectNode) original).deepCopy());
    }
}
