package io.contextlink.client;

public enum ConnectionStatus {
    CONNECTING,
    CONNECTED,
    DISCONNECTED_UNEXPECTEDLY,
    CONNECTION_ERROR,
    FAILED_MAX_RETRIES
}
