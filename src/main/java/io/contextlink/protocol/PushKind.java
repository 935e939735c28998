package io.contextlink.protocol;

import java.util.Optional;

public enum PushKind {
    PUSH_SNIPPET("push_snippet"),
    FORWARD_REQUEST("forward_request"),
    FORWARD_RESPONSE_TO_PRIMARY("forward_response_to_primary"),
    FORWARD_PUSH_TO_PRIMARY("forward_push_to_primary");

    private final String wireName;

    PushKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<PushKind> fromWire(String raw) {
        for (PushKind value : values()) {
            if (value.wireName.equals(raw)) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }
}
