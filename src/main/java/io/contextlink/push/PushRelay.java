package io.contextlink.push;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.contextlink.protocol.Envelope;
import io.contextlink.protocol.PushKind;
import io.contextlink.server.ClientRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

public final class PushRelay {
    private static final Logger LOG = LoggerFactory.getLogger(PushRelay.class);

    private final ActiveTabRegistry tabs;

    public PushRelay(ActiveTabRegistry tabs) {
        this.tabs = tabs;
    }

    public int deliver(PushKind kind, JsonNode payload, String targetTabId) {
        if (targetTabId == null || targetTabId.isBlank()) {
            return broadcast(kind, payload);
        }
        Optional<ClientRecord> target = tabs.findByTabId(targetTabId);
        if (target.isEmpty()) {
            LOG.warn("No client registered for tab {}; {} not delivered", targetTabId, kind.wireName());
            return 0;
        }
        return send(target.get(), kind, payload) ? 1 : 0;
    }

    public boolean deliverToActiveTab(PushKind kind, ObjectNode payload) {
        Optional<ClientRecord> target = tabs.currentTarget();
        if (target.isEmpty()) {
            LOG.warn("No active target tab registered; {} not delivered", kind.wireName());
            return false;
        }
        ClientRecord client = target.get();
        payload.put("targetTabId", client.activeTabId().orElse(null));
        return send(client, kind, payload);
    }

    public int broadcast(PushKind kind, JsonNode payload) {
        List<ClientRecord> recipients = tabs.recipients();
        if (recipients.isEmpty()) {
            LOG.warn("No recipients for {}", kind.wireName());
            return 0;
        }
        int delivered = 0;
        for (ClientRecord recipient : recipients) {
            if (send(recipient, kind, payload)) {
                delivered++;
            }
        }
        return delivered;
    }

    private boolean send(ClientRecord client, PushKind kind, JsonNode payload) {
        if (!client.connection().isOpen()) {
            LOG.warn("Connection for {} is not open; {} skipped", client.id(), kind.wireName());
            return false;
        }
        try {
            client.send(Envelope.push(kind, payload));
            LOG.info("Pushed {} to {}", kind.wireName(), client.activeTabId().orElse(client.id()));
            return true;
        } catch (RuntimeException e) {
            LOG.warn("Failed to push {} to {}: {}", kind.wireName(), client.id(), e.getMessage());
            return false;
        }
    }
}
