package io.contextlink.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.contextlink.config.ContextLinkConfig;
import io.contextlink.util.Jsons;

public final class EnvelopeCodec {
    static final String FIELD_PROTOCOL_VERSION = "protocol_version";
    static final String FIELD_MESSAGE_ID = "message_id";
    static final String FIELD_TYPE = "type";
    static final String FIELD_COMMAND = "command";
    static final String FIELD_PAYLOAD = "payload";

    private EnvelopeCodec() {
    }

    public static String encode(Envelope envelope) {
        ObjectNode node = Jsons.object();
        node.put(FIELD_PROTOCOL_VERSION, envelope.protocolVersion());
        node.put(FIELD_MESSAGE_ID, envelope.messageId());
        node.put(FIELD_TYPE, envelope.type().wireName());
        node.put(FIELD_COMMAND, envelope.command());
        node.set(FIELD_PAYLOAD, envelope.payload());
        return Jsons.toJson(node);
    }

    public static Envelope decode(String frame) {
        JsonNode root;
        try {
            root = Jsons.mapper().readTree(frame == null ? "" : frame);
        } catch (JsonProcessingException e) {
            throw new ProtocolException(ErrorCode.INVALID_MESSAGE_FORMAT,
                    "Error parsing message: " + e.getOriginalMessage(), null, e);
        }
        if (root == null || !root.isObject()) {
            throw new ProtocolException(ErrorCode.INVALID_MESSAGE_FORMAT,
                    "Message does not conform to IPC message structure.", null);
        }
        String messageId = text(root, FIELD_MESSAGE_ID);
        String version = text(root, FIELD_PROTOCOL_VERSION);
        String type = text(root, FIELD_TYPE);
        String command = text(root, FIELD_COMMAND);
        if (version == null || messageId == null || type == null || command == null) {
            throw new ProtocolException(ErrorCode.INVALID_MESSAGE_FORMAT,
                    "Message does not conform to IPC message structure.", messageId);
        }
        MessageType messageType;
        try {
            messageType = MessageType.fromWire(type);
        } catch (IllegalArgumentException e) {
            throw new ProtocolException(ErrorCode.INVALID_MESSAGE_FORMAT, e.getMessage(), messageId, e);
        }
        if (!ContextLinkConfig.PROTOCOL_VERSION.equals(version)) {
            throw new ProtocolException(ErrorCode.UNSUPPORTED_PROTOCOL_VERSION,
                    "Protocol version mismatch. Expected " + ContextLinkConfig.PROTOCOL_VERSION + ", got " + version + ".",
                    messageId);
        }
        JsonNode payload = root.get(FIELD_PAYLOAD);
        if (payload == null || payload.isNull()) {
            payload = Jsons.object();
        }
        return new Envelope(version, messageId, messageType, command, payload);
    }

    private static String text(JsonNode root, String field) {
        JsonNode value = root.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            return null;
        }
        return value.asText();
    }
}
