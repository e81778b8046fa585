package com.quorumbridge.bridge.domain;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for BridgeTransactionStatus
 */
class BridgeTransactionStatusTest {

    @ParameterizedTest
    @EnumSource(value = BridgeTransactionStatus.class, names = {"COMPLETED", "FAILED", "CANCELLED"})
    void shouldIdentifyTerminalStatuses(BridgeTransactionStatus status) {
        assertTrue(status.isTerminal(), status + " should be terminal");
    }

    @Test
    void shouldTreatPendingAsOnlyOpenStatus() {
        assertFalse(BridgeTransactionStatus.PENDING.isTerminal());
    }

    @ParameterizedTest
    @EnumSource(value = BridgeTransactionStatus.class, names = {"FAILED", "CANCELLED"})
    void shouldIdentifyRefundedStatuses(BridgeTransactionStatus status) {
        assertTrue(status.isRefunded(), status + " should be refunded");
    }

    @Test
    void shouldNotRefundCompletedTransfers() {
        assertFalse(BridgeTransactionStatus.COMPLETED.isRefunded());
    }

    @Test
    void shouldLockAmountPlusFee() {
        // Given a pending transaction
        BridgeTransaction tx = BridgeTransaction.builder()
                .amount(BigInteger.valueOf(1_000))
                .fee(BigInteger.valueOf(11))
                .status(BridgeTransactionStatus.PENDING)
                .build();

        // Then the locked total covers both
        assertThat(tx.lockedTotal()).isEqualTo(BigInteger.valueOf(1_011));
        assertThat(tx.isPending()).isTrue();
    }
}
