package com.quorumbridge.bridge.exception;

import org.springframework.http.HttpStatus;

/**
 * Broad classes of rejected bridge operations.
 *
 * <p>Off-chain tooling keys retry decisions on the category together with
 * {@link BridgeException#isRetryable()}.</p>
 */
public enum ErrorCategory {

    /** Malformed input: zero address, zero amount, amount out of bounds. */
    VALIDATION(HttpStatus.BAD_REQUEST),

    /** Caller is not the validator, owner or participant the operation requires. */
    AUTHORIZATION(HttpStatus.FORBIDDEN),

    /** Operation is invalid for the current transaction, validator or challenge status. */
    STATE(HttpStatus.CONFLICT),

    /** Insufficient stake, fund balance, voting power or volume allowance. */
    ECONOMIC(HttpStatus.UNPROCESSABLE_ENTITY),

    /** Referenced transaction, validator, challenge or chain does not exist. */
    NOT_FOUND(HttpStatus.NOT_FOUND);

    private final HttpStatus httpStatus;

    ErrorCategory(HttpStatus httpStatus) {
        this.httpStatus = httpStatus;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }
}
