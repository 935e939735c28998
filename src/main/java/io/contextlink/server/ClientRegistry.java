package io.contextlink.server;

import io.contextlink.push.ActiveTabRegistry;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class ClientRegistry implements ActiveTabRegistry {
    private final Map<String, ClientRecord> clients = new LinkedHashMap<>();

    public synchronized ClientRecord add(PeerConnection connection) {
        ClientRecord record = new ClientRecord(connection, true);
        clients.put(connection.id(), record);
        return record;
    }

    public synchronized Optional<ClientRecord> remove(PeerConnection connection) {
        return Optional.ofNullable(clients.remove(connection.id()));
    }

    public synchronized Optional<ClientRecord> find(PeerConnection connection) {
        return Optional.ofNullable(clients.get(connection.id()));
    }

    public synchronized List<ClientRecord> snapshot() {
        return new ArrayList<>(clients.values());
    }

    public synchronized int size() {
        return clients.size();
    }

    @Override
    public synchronized Optional<ClientRecord> currentTarget() {
        for (ClientRecord record : clients.values()) {
            if (record.isAuthenticated() && !record.isSecondary() && record.activeTabId().isPresent()) {
                return Optional.of(record);
            }
        }
        return Optional.empty();
    }

    @Override
    public synchronized Optional<ClientRecord> findByTabId(String tabId) {
        if (tabId == null) {
            return Optional.empty();
        }
        for (ClientRecord record : clients.values()) {
            if (record.isAuthenticated() && tabId.equals(record.activeTabId().orElse(null))) {
                return Optional.of(record);
            }
        }
        return Optional.empty();
    }

    @Override
    public synchronized List<ClientRecord> recipients() {
        List<ClientRecord> out = new ArrayList<>();
        for (ClientRecord record : clients.values()) {
            if (record.isAuthenticated() && !record.isSecondary()) {
                out.add(record);
            }
        }
        return out;
    }
}
