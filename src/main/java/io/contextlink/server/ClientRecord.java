package io.contextlink.server;

import io.contextlink.protocol.Envelope;
import io.contextlink.protocol.EnvelopeCodec;

import java.util.Optional;

public final class ClientRecord {
    private final PeerConnection connection;
    private final boolean authenticated;
    private volatile String activeTabId;
    private volatile String activeHost;
    private volatile String windowId;

    public ClientRecord(PeerConnection connection, boolean authenticated) {
        this.connection = connection;
        this.authenticated = authenticated;
    }

    public PeerConnection connection() {
        return connection;
    }

    public String id() {
        return connection.id();
    }

    public String remoteAddress() {
        return connection.remoteAddress();
    }

    public boolean isAuthenticated() {
        return authenticated;
    }

    public Optional<String> activeTabId() {
        return Optional.ofNullable(activeTabId);
    }

    public Optional<String> activeHost() {
        return Optional.ofNullable(activeHost);
    }

    public Optional<String> windowId() {
        return Optional.ofNullable(windowId);
    }

    public boolean isSecondary() {
        return windowId != null;
    }

    public void markActiveTarget(String tabId, String host) {
        this.activeTabId = tabId;
        this.activeHost = host;
    }

    public void markSecondary(String windowId) {
        this.windowId = windowId;
    }

    public void clearSecondary() {
        this.windowId = null;
    }

    public void send(Envelope envelope) {
        connection.send(EnvelopeCodec.encode(envelope));
    }

    @Override
    public String toString() {
        return "ClientRecord{" +
                "id=" + id() +
                ", remote=" + remoteAddress() +
                ", activeTabId=" + activeTabId +
                ", windowId=" + windowId +
                '}';
    }
}
