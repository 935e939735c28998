package io.contextlink.client;

import org.java_websocket.client.WebSocketClient;
import org.java_websocket.drafts.Draft_6455;
import org.java_websocket.handshake.ServerHandshake;

import java.net.URI;

final class LinkSocket extends WebSocketClient {
    interface Events {
        void onOpened(LinkSocket socket);

        void onText(LinkSocket socket, String text);

        void onClosed(LinkSocket socket, int code, String reason, boolean remote);

        void onFailure(LinkSocket socket, Exception error);
    }

    private final int port;
    private volatile Events events;
    private volatile boolean intentionalClose;

    LinkSocket(String host, int port, int connectTimeoutMs, Events events) {
        super(URI.create("ws://" + host + ":" + port), new Draft_6455(), null, connectTimeoutMs);
        this.port = port;
        this.events = events;
    }

    int port() {
        return port;
    }

    void events(Events events) {
        this.events = events;
    }

    boolean intentionalClose() {
        return intentionalClose;
    }

    void closeIntentionally() {
        intentionalClose = true;
        close();
    }

    @Override
    public void onOpen(ServerHandshake handshake) {
        events.onOpened(this);
    }

    @Override
    public void onMessage(String message) {
        events.onText(this, message);
    }

    @Override
    public void onClose(int code, String reason, boolean remote) {
        events.onClosed(this, code, reason, remote);
    }

    @Override
    public void onError(Exception ex) {
        events.onFailure(this, ex);
    }
}
