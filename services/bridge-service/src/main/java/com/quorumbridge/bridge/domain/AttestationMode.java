package com.quorumbridge.bridge.domain;

/**
 * How validators prove agreement with a transfer.
 */
public enum AttestationMode {
    /** Signature over the canonical transfer hash in a single step. */
    DIRECT,
    /** Hash commitment first, salt and signature over the commitment later. */
    COMMIT_REVEAL
}
