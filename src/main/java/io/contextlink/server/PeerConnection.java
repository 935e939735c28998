package io.contextlink.server;

public interface PeerConnection {
    String id();

    String remoteAddress();

    boolean isOpen();

    void send(String frame);

    void close();
}
