package io.contextlink.window.aggregation;

import com.fasterxml.jackson.databind.JsonNode;
import io.contextlink.protocol.Command;
import io.contextlink.server.ClientRecord;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ScheduledFuture;

public final class AggregationContext {
    public enum Offer {
        ACCEPTED,
        READY,
        LATE,
        UNEXPECTED
    }

    private final String aggregationId;
    private final String originalMessageId;
    private final ClientRecord requester;
    private final Command command;
    private final List<String> expectedOrder;
    private final Set<String> outstanding;
    private final Map<String, JsonNode> collected = new HashMap<>();
    private WindowContribution local;
    private boolean completed;
    private ScheduledFuture<?> deadline;

    AggregationContext(String aggregationId, String originalMessageId, ClientRecord requester, Command command,
                       List<String> expectedWindowIds) {
        this.aggregationId = aggregationId;
        this.originalMessageId = originalMessageId;
        this.requester = requester;
        this.command = command;
        this.expectedOrder = List.copyOf(expectedWindowIds);
        this.outstanding = new LinkedHashSet<>(expectedWindowIds);
    }

    public String aggregationId() {
        return aggregationId;
    }

    public String originalMessageId() {
        return originalMessageId;
    }

    public ClientRecord requester() {
        return requester;
    }

    public Command command() {
        return command;
    }

    synchronized void deadline(ScheduledFuture<?> deadline) {
        this.deadline = deadline;
    }

    synchronized boolean contributeLocal(String windowId, JsonNode payload) {
        if (completed) {
            return false;
        }
        local = new WindowContribution(windowId, payload);
        return isReady();
    }

    synchronized Offer offer(String windowId, JsonNode payload) {
        if (completed) {
            return Offer.LATE;
        }
        if (!outstanding.remove(windowId)) {
            return Offer.UNEXPECTED;
        }
        collected.put(windowId, payload);
        return isReady() ? Offer.READY : Offer.ACCEPTED;
    }

    synchronized boolean drop(String windowId) {
        if (completed || !outstanding.remove(windowId)) {
            return false;
        }
        return isReady();
    }

    public synchronized Set<String> outstanding() {
        return Set.copyOf(outstanding);
    }

    synchronized Optional<List<WindowContribution>> complete() {
        if (completed) {
            return Optional.empty();
        }
        completed = true;
        if (deadline != null) {
            deadline.cancel(false);
        }
        List<WindowContribution> out = new ArrayList<>();
        if (local != null) {
            out.add(local);
        }
        for (String windowId : expectedOrder) {
            JsonNode payload = collected.get(windowId);
            if (payload != null) {
                out.add(new WindowContribution(windowId, payload));
            }
        }
        return Optional.of(out);
    }

    private boolean isReady() {
        return local != null && outstanding.isEmpty();
    }
}
