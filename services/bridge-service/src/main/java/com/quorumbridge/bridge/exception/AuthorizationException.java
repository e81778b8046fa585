package com.quorumbridge.bridge.exception;

/**
 * Exception thrown when the caller may not perform the requested operation
 */
public class AuthorizationException extends BridgeException {

    public AuthorizationException(ErrorCode code, String message) {
        super(code, message, false);
    }

    public AuthorizationException(ErrorCode code, String message, boolean retryable) {
        super(code, message, retryable);
    }

    public AuthorizationException(ErrorCode code, String message, Throwable cause) {
        super(code, message, false, cause);
    }

    @Override
    public ErrorCategory getCategory() {
        return ErrorCategory.AUTHORIZATION;
    }
}
