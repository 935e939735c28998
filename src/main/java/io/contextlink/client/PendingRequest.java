package io.contextlink.client;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

final class PendingRequest {
    private final String messageId;
    private final String command;
    private final CompletableFuture<JsonNode> result;
    private final AtomicBoolean settled = new AtomicBoolean();
    private volatile ScheduledFuture<?> deadline;

    PendingRequest(String messageId, String command, CompletableFuture<JsonNode> result) {
        this.messageId = messageId;
        this.command = command;
        this.result = result;
    }

    String messageId() {
        return messageId;
    }

    String command() {
        return command;
    }

    void deadline(ScheduledFuture<?> deadline) {
        this.deadline = deadline;
    }

    boolean resolve(JsonNode payload) {
        if (!settled.compareAndSet(false, true)) {
            return false;
        }
        cancelDeadline();
        result.complete(payload);
        return true;
    }

    boolean reject(Throwable error) {
        if (!settled.compareAndSet(false, true)) {
            return false;
        }
        cancelDeadline();
        result.completeExceptionally(error);
        return true;
    }

    private void cancelDeadline() {
        ScheduledFuture<?> current = deadline;
        if (current != null) {
            current.cancel(false);
        }
    }
}
