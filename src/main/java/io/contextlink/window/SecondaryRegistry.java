package io.contextlink.window;

import io.contextlink.protocol.ErrorCode;
import io.contextlink.server.ClientRecord;
import io.contextlink.server.CommandException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class SecondaryRegistry {
    private final Map<String, SecondaryRegistration> byWindow = new LinkedHashMap<>();
    private final int maxSecondaries;

    public SecondaryRegistry(int maxSecondaries) {
        this.maxSecondaries = maxSecondaries;
    }

    // Entries the same client held under other window ids are dropped.
    public synchronized List<SecondaryRegistration> register(String windowId, int port, ClientRecord client) {
        List<String> stale = new ArrayList<>();
        for (SecondaryRegistration existing : byWindow.values()) {
            if (existing.client() == client && !existing.windowId().equals(windowId)) {
                stale.add(existing.windowId());
            }
        }
        if (!byWindow.containsKey(windowId) && byWindow.size() - stale.size() >= maxSecondaries) {
            throw new CommandException(ErrorCode.COMMAND_EXECUTION_ERROR,
                    "Secondary limit reached (" + maxSecondaries + ")");
        }
        List<SecondaryRegistration> displaced = new ArrayList<>();
        for (String id : stale) {
            displaced.add(byWindow.remove(id));
        }
        SecondaryRegistration previous = byWindow.put(windowId, new SecondaryRegistration(windowId, port, client));
        if (previous != null) {
            displaced.add(previous);
        }
        client.markSecondary(windowId);
        return displaced;
    }

    public synchronized Optional<SecondaryRegistration> unregister(String windowId) {
        return Optional.ofNullable(byWindow.remove(windowId));
    }

    public synchronized Optional<SecondaryRegistration> removeByClient(ClientRecord client) {
        for (SecondaryRegistration current : byWindow.values()) {
            if (current.client() == client) {
                byWindow.remove(current.windowId());
                return Optional.of(current);
            }
        }
        return Optional.empty();
    }

    public synchronized List<SecondaryRegistration> snapshot() {
        return new ArrayList<>(byWindow.values());
    }

    public synchronized List<String> windowIds() {
        return new ArrayList<>(byWindow.keySet());
    }

    public synchronized int size() {
        return byWindow.size();
    }

    public synchronized void clear() {
        byWindow.clear();
    }
}
