package com.quorumbridge.bridge.domain;

public enum CommitmentStatus {
    PENDING,
    REVEALED,
    EXPIRED
}
