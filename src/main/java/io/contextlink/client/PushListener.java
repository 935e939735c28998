package io.contextlink.client;

import io.contextlink.protocol.Envelope;

@FunctionalInterface
public interface PushListener {
    void onPush(Envelope push);
}
