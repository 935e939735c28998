package io.contextlink.client;

import com.fasterxml.jackson.databind.JsonNode;
import io.contextlink.TestSupport;
import io.contextlink.config.ContextLinkConfig;
import io.contextlink.protocol.Envelope;
import io.contextlink.protocol.EnvelopeCodec;
import io.contextlink.protocol.MessageType;
import io.contextlink.protocol.Payloads;
import io.contextlink.protocol.PushKind;
import io.contextlink.server.IpcServer;
import io.contextlink.server.PeerConnection;
import io.contextlink.util.Jsons;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RequestRouterTest {
    private final List<Envelope> serverReceived = new CopyOnWriteArrayList<>();
    private IpcServer server;
    private ConnectionSupervisor supervisor;
    private RequestRouter router;

    @BeforeEach
    void setUp() throws Exception {
        ContextLinkConfig config = TestSupport.fastConfig(2);
        server = IpcServer.tryBind(config.host(), config.portRangeStart(), new IpcServer.Listener() {
            @Override
            public void onOpen(PeerConnection connection) {
            }

            @Override
            public void onFrame(PeerConnection connection, String frame) {
                serverReceived.add(EnvelopeCodec.decode(frame));
            }

            @Override
            public void onClose(PeerConnection connection) {
            }
        }).orElseThrow();
        supervisor = new ConnectionSupervisor(config);
        router = new RequestRouter(supervisor, config.requestTimeoutMs());
        supervisor.ensureConnected().get(10, TimeUnit.SECONDS);
    }

    @AfterEach
    void tearDown() {
        supervisor.close();
        server.shutdown();
    }

    private static String frame(String version, String messageId, String type, String command) {
        return Jsons.toJson(Jsons.object()
                .put("protocol_version", version)
                .put("message_id", messageId)
                .put("type", type)
                .put("command", command)
                .set("payload", Jsons.object()));
    }

    @Test
    void malformedFramesShouldBeAnsweredOnlyWhenAnIdIsRecoverable() {
        router.onFrame("not json at all");
        router.onFrame(frame("0.9", "m-bad-version", "response", "response_search_workspace"));

        assertTrue(TestSupport.await(() -> !serverReceived.isEmpty(), 5_000L));
        Envelope error = serverReceived.get(0);
        assertEquals(MessageType.ERROR_RESPONSE, error.type());
        assertEquals("m-bad-version", error.messageId());
        assertEquals("UNSUPPORTED_PROTOCOL_VERSION", Payloads.errorCode(error.payload()));

        router.onFrame(frame("1.0", "m-marker", "request", "get_open_files"));
        assertTrue(TestSupport.await(() -> serverReceived.size() == 2, 5_000L));
        assertEquals("m-marker", serverReceived.get(1).messageId());
    }

    @Test
    void serverSentRequestShouldBeRejected() {
        router.onFrame(frame("1.0", "m-req", "request", "get_open_files"));

        assertTrue(TestSupport.await(() -> serverReceived.size() == 1, 5_000L));
        Envelope error = serverReceived.get(0);
        assertEquals("m-req", error.messageId());
        assertEquals("INVALID_MESSAGE_TYPE", Payloads.errorCode(error.payload()));
    }

    @Test
    void answerForUnknownRequestShouldBeDropped() throws Exception {
        CompletableFuture<JsonNode> pending = router.send("get_open_files", Jsons.object());
        assertTrue(TestSupport.await(() -> serverReceived.size() == 1, 5_000L));
        String requestId = serverReceived.get(0).messageId();
        assertEquals(1, router.pendingCount());

        router.onFrame(frame("1.0", "m-nobody", "response", "response_open_files"));
        assertEquals(1, router.pendingCount());

        router.onFrame(EnvelopeCodec.encode(Envelope.response(requestId, "response_open_files",
                Payloads.ok(Jsons.object().put("marker", 7)))));
        assertEquals(7, pending.get(5, TimeUnit.SECONDS).path("data").path("marker").asInt());
        assertEquals(0, router.pendingCount());
        assertEquals(1, serverReceived.size());
    }

    @Test
    void pushesShouldReachListenersWithoutTouchingPendingRequests() {
        List<Envelope> pushes = new CopyOnWriteArrayList<>();
        router.addPushListener(pushes::add);

        router.onFrame(EnvelopeCodec.encode(Envelope.push(PushKind.PUSH_SNIPPET, Jsons.object().put("snippet", "x"))));

        assertEquals(1, pushes.size());
        assertEquals("x", pushes.get(0).payload().path("snippet").asText());
        assertEquals(0, router.pendingCount());
    }
}
