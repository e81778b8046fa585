package com.quorumbridge.bridge.exception;

/**
 * Specific failure kinds returned to callers.
 */
public enum ErrorCode {

    // Validation
    INVALID_ADDRESS,
    INVALID_AMOUNT,
    AMOUNT_OUT_OF_BOUNDS,
    AMOUNT_OVERFLOW,
    UNSUPPORTED_CHAIN,
    INVALID_CHAIN_CONFIGURATION,
    INVALID_PROOF,
    INVALID_REASON,
    INVALID_COMMITMENT,
    ATTESTATION_NOT_FOUND,

    // Authorization
    NOT_OWNER,
    NOT_ARBITRATOR,
    NOT_TRANSACTION_OWNER,
    NOT_ELIGIBLE_VALIDATOR,
    INVALID_SIGNATURE,
    VALIDATOR_BANNED,
    SELF_CHALLENGE,
    CONFLICT_OF_INTEREST,

    // State
    ALREADY_REGISTERED,
    NOT_REGISTERED,
    CAPACITY_EXCEEDED,
    BELOW_QUORUM_THRESHOLD,
    TRANSACTION_NOT_PENDING,
    TIMEOUT_NOT_REACHED,
    ATTESTATION_WINDOW_EXPIRED,
    DUPLICATE_ATTESTATION,
    DUPLICATE_COMMITMENT,
    COMMITMENT_NOT_FOUND,
    ATTESTATION_MODE_MISMATCH,
    CONFLICTING_VOTE,
    DUPLICATE_VOTE,
    VALIDATOR_NOT_ACTIVE,
    DUPLICATE_CHALLENGE,
    ATTESTATION_ALREADY_SLASHED,
    CHALLENGE_WINDOW_CLOSED,
    CHALLENGE_PERIOD_ACTIVE,
    VOTING_CLOSED,
    NO_VOTES_CAST,
    ALREADY_RESOLVED,

    // Economic
    INSUFFICIENT_STAKE,
    INSUFFICIENT_FUNDS,
    INSUFFICIENT_VOTING_POWER,
    DAILY_LIMIT_EXCEEDED,
    TOKEN_TRANSFER_FAILED,
    TOKEN_LEDGER_UNAVAILABLE,

    // Not found
    TRANSACTION_NOT_FOUND,
    VALIDATOR_NOT_FOUND,
    CHALLENGE_NOT_FOUND,
    CHAIN_NOT_FOUND
}
