package io.contextlink.client;

@FunctionalInterface
public interface ConnectionStatusListener {
    void onStatus(ConnectionStatus status, String detail);
}
