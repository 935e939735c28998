package io.contextlink.protocol;

import java.util.Optional;

public final class ProtocolException extends RuntimeException {
    private final ErrorCode errorCode;
    private final String recoveredMessageId;

    public ProtocolException(ErrorCode errorCode, String message, String recoveredMessageId) {
        super(message);
        this.errorCode = errorCode;
        this.recoveredMessageId = recoveredMessageId == null || recoveredMessageId.isBlank() ? null : recoveredMessageId;
    }

    public ProtocolException(ErrorCode errorCode, String message, String recoveredMessageId, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.recoveredMessageId = recoveredMessageId == null || recoveredMessageId.isBlank() ? null : recoveredMessageId;
    }

    public ErrorCode errorCode() {
        return errorCode;
    }

    public Optional<String> recoveredMessageId() {
        return Optional.ofNullable(recoveredMessageId);
    }
}
