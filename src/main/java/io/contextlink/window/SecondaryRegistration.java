package io.contextlink.window;

import io.contextlink.server.ClientRecord;

public record SecondaryRegistration(String windowId, int listeningPort, ClientRecord client) {
}
