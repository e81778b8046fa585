package com.quorumbridge.bridge.exception;

/**
 * Exception thrown when a referenced resource does not exist
 */
public class ResourceNotFoundException extends BridgeException {

    public ResourceNotFoundException(ErrorCode code, String message) {
        super(code, message, false);
    }

    public ResourceNotFoundException(ErrorCode code, String message, boolean retryable) {
        super(code, message, retryable);
    }

    public ResourceNotFoundException(ErrorCode code, String message, Throwable cause) {
        super(code, message, false, cause);
    }

    @Override
    public ErrorCategory getCategory() {
        return ErrorCategory.NOT_FOUND;
    }
}
