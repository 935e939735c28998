package io.contextlink.protocol;

public enum MessageType {
    REQUEST("request"),
    RESPONSE("response"),
    ERROR_RESPONSE("error_response"),
    PUSH("push");

    private final String wireName;

    MessageType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static MessageType fromWire(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Message type is empty");
        }
        for (MessageType value : values()) {
            if (value.wireName.equals(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown message type: " + raw);
    }
}
