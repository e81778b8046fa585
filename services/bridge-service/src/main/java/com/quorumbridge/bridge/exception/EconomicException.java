package com.quorumbridge.bridge.exception;

/**
 * Exception thrown when stake, fund balance, voting power or volume allowance is insufficient
 */
public class EconomicException extends BridgeException {

    public EconomicException(ErrorCode code, String message) {
        super(code, message, false);
    }

    public EconomicException(ErrorCode code, String message, boolean retryable) {
        super(code, message, retryable);
    }

    public EconomicException(ErrorCode code, String message, Throwable cause) {
        super(code, message, false, cause);
    }

    public EconomicException(ErrorCode code, String message, boolean retryable, Throwable cause) {
        super(code, message, retryable, cause);
    }

    @Override
    public ErrorCategory getCategory() {
        return ErrorCategory.ECONOMIC;
    }
}
