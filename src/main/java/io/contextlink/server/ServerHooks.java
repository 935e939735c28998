package io.contextlink.server;

import io.contextlink.protocol.Envelope;

public interface ServerHooks {
    ServerHooks LOCAL_ONLY = new ServerHooks() {
    };

    // true when the request was taken over and will be answered elsewhere.
    default boolean interceptRequest(Envelope request, ClientRecord client) {
        return false;
    }

    default void onPush(Envelope push, ClientRecord client) {
    }

    default void onDisconnect(ClientRecord client) {
    }
}
