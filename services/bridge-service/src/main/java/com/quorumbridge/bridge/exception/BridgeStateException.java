package com.quorumbridge.bridge.exception;

/**
 * Exception thrown when an operation is invalid for the current status of a transaction, validator or challenge
 */
public class BridgeStateException extends BridgeException {

    public BridgeStateException(ErrorCode code, String message) {
        super(code, message, false);
    }

    public BridgeStateException(ErrorCode code, String message, boolean retryable) {
        super(code, message, retryable);
    }

    public BridgeStateException(ErrorCode code, String message, Throwable cause) {
        super(code, message, false, cause);
    }

    @Override
    public ErrorCategory getCategory() {
        return ErrorCategory.STATE;
    }
}
