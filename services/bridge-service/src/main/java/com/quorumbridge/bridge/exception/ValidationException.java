package com.quorumbridge.bridge.exception;

/**
 * Exception thrown when input is malformed or outside configured bounds
 */
public class ValidationException extends BridgeException {

    public ValidationException(ErrorCode code, String message) {
        super(code, message, false);
    }

    public ValidationException(ErrorCode code, String message, boolean retryable) {
        super(code, message, retryable);
    }

    public ValidationException(ErrorCode code, String message, Throwable cause) {
        super(code, message, false, cause);
    }

    @Override
    public ErrorCategory getCategory() {
        return ErrorCategory.VALIDATION;
    }
}
