package com.quorumbridge.bridge.domain;

public enum ReserveFundType {
    /** Share of slashed stake kept to cover losses from fraudulent transfers. */
    INSURANCE,
    /** Fees of completed transfers, withdrawable by the owner. */
    FEES
}
