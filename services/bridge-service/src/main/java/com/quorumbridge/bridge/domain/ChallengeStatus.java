package com.quorumbridge.bridge.domain;

public enum ChallengeStatus {
    OPEN,
    /** The attestation was found fraudulent; the validator was slashed. */
    UPHELD,
    /** The attestation stands; the challenger got the stake back. */
    REJECTED
}
