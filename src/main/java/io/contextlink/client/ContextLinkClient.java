package io.contextlink.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.contextlink.config.ContextLinkConfig;
import io.contextlink.protocol.Command;
import io.contextlink.util.Jsons;

import java.util.concurrent.CompletableFuture;

public final class ContextLinkClient implements AutoCloseable {
    private final ConnectionSupervisor supervisor;
    private final RequestRouter router;

    public ContextLinkClient(ContextLinkConfig config) {
        this.supervisor = new ConnectionSupervisor(config);
        this.router = new RequestRouter(supervisor, config.requestTimeoutMs());
    }

    public ConnectionSupervisor supervisor() {
        return supervisor;
    }

    public RequestRouter router() {
        return router;
    }

    public CompletableFuture<Void> connect() {
        return supervisor.ensureConnected();
    }

    public CompletableFuture<JsonNode> request(Command command, JsonNode payload) {
        return router.send(command.wireName(), payload == null ? Jsons.object() : payload);
    }

    public CompletableFuture<JsonNode> request(String command, JsonNode payload) {
        return router.send(command, payload == null ? Jsons.object() : payload);
    }

    public CompletableFuture<JsonNode> registerActiveTarget(String tabId, String llmHost) {
        ObjectNode payload = Jsons.object();
        payload.put("tabId", tabId);
        payload.put("llmHost", llmHost);
        return request(Command.REGISTER_ACTIVE_TARGET, payload);
    }

    public CompletableFuture<JsonNode> searchWorkspace(String query) {
        ObjectNode payload = Jsons.object();
        payload.put("query", query);
        return request(Command.SEARCH_WORKSPACE, payload);
    }

    public void onPush(PushListener listener) {
        router.addPushListener(listener);
    }

    public void onStatus(ConnectionStatusListener listener) {
        supervisor.addStatusListener(listener);
    }

    @Override
    public void close() {
        supervisor.close();
    }
}
