package io.contextlink.client;

public final class IpcClientException extends RuntimeException {
    private final String errorCode;

    public IpcClientException(String message, String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public IpcClientException(String message, String errorCode, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String errorCode() {
        return errorCode;
    }
}
