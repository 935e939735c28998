package io.contextlink.server;

import org.java_websocket.WebSocket;

import java.net.InetSocketAddress;
import java.util.UUID;

final class WebSocketPeer implements PeerConnection {
    private final String id = UUID.randomUUID().toString();
    private final WebSocket socket;

    WebSocketPeer(WebSocket socket) {
        this.socket = socket;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public String remoteAddress() {
        InetSocketAddress address = socket.getRemoteSocketAddress();
        return address == null ? "unknown" : address.getAddress().getHostAddress() + ":" + address.getPort();
    }

    @Override
    public boolean isOpen() {
        return socket.isOpen();
    }

    @Override
    public void send(String frame) {
        socket.send(frame);
    }

    @Override
    public void close() {
        socket.close();
    }

    @Override
    public String toString() {
        return "WebSocketPeer{" + id + "@" + remoteAddress() + "}";
    }
}
