package com.quorumbridge.bridge.exception;

/**
 * Base exception for bridge service
 */
public abstract class BridgeException extends RuntimeException {

    private final ErrorCode code;
    private final boolean retryable;

    protected BridgeException(ErrorCode code, String message, boolean retryable) {
        super(message);
        this.code = code;
        this.retryable = retryable;
    }

    protected BridgeException(ErrorCode code, String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.retryable = retryable;
    }

    public abstract ErrorCategory getCategory();

    public ErrorCode getCode() {
        return code;
    }

    /**
     * True when the same call may succeed later without any change to its input,
     * e.g. a timeout that has not elapsed yet.
     */
    public boolean isRetryable() {
        return retryable;
    }
}
