package io.contextlink.protocol;

public enum ErrorCode {
    INVALID_MESSAGE_FORMAT,
    UNSUPPORTED_PROTOCOL_VERSION,
    INVALID_MESSAGE_TYPE,
    UNKNOWN_COMMAND,
    COMMAND_EXECUTION_ERROR,
    WORKSPACE_NOT_TRUSTED,
    NO_WORKSPACE_OPEN,
    INVALID_PAYLOAD,
    FILE_NOT_FOUND,
    NO_ACTIVE_FILE,
    NOT_PRIMARY,
    NO_RESPONSES,
    NOT_CONNECTED,
    REQUEST_TIMEOUT
}
