package io.contextlink.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import io.contextlink.config.ContextLinkConfig;
import io.contextlink.util.Jsons;

import java.util.UUID;

public record Envelope(
        String protocolVersion,
        String messageId,
        MessageType type,
        String command,
        JsonNode payload
) {
    public static final String ERROR_COMMAND = "error_response";

    public Envelope {
        payload = payload == null ? Jsons.object() : payload;
    }

    public static String newMessageId() {
        return UUID.randomUUID().toString();
    }

    public static Envelope request(String command, JsonNode payload) {
        return new Envelope(ContextLinkConfig.PROTOCOL_VERSION, newMessageId(), MessageType.REQUEST, command, payload);
    }

    public static Envelope response(String messageId, String command, JsonNode payload) {
        return new Envelope(ContextLinkConfig.PROTOCOL_VERSION, messageId, MessageType.RESPONSE, command, payload);
    }

    // A fresh id is used when none could be recovered.
    public static Envelope error(String messageId, ErrorCode code, String message) {
        return error(messageId, code.name(), message);
    }

    public static Envelope error(String messageId, String code, String message) {
        String id = messageId == null || messageId.isBlank() ? newMessageId() : messageId;
        return new Envelope(ContextLinkConfig.PROTOCOL_VERSION, id, MessageType.ERROR_RESPONSE, ERROR_COMMAND,
                Payloads.error(code, message));
    }

    public static Envelope push(PushKind kind, JsonNode payload) {
        return push(newMessageId(), kind, payload);
    }

    public static Envelope push(String messageId, PushKind kind, JsonNode payload) {
        return new Envelope(ContextLinkConfig.PROTOCOL_VERSION, messageId, MessageType.PUSH, kind.wireName(), payload);
    }

    public boolean isAnswer() {
        return type == MessageType.RESPONSE || type == MessageType.ERROR_RESPONSE;
    }
}
