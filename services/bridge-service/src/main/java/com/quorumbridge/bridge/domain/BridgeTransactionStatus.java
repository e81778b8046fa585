package com.quorumbridge.bridge.domain;

/**
 * Bridge transaction lifecycle. Funds are locked at initiation, so a transaction is
 * created directly in {@link #PENDING}.
 */
public enum BridgeTransactionStatus {
    PENDING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this != PENDING;
    }

    /** True when the locked amount and fee went back to the user. */
    public boolean isRefunded() {
        return this == FAILED || this == CANCELLED;
    }
}
