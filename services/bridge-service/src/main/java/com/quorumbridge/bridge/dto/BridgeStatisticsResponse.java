package com.quorumbridge.bridge.dto;

import com.quorumbridge.bridge.domain.BridgeTransactionStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

/**
 * Aggregate view of bridge volume. Principal released plus principal refunded plus
 * principal of pending transfers always equals principal locked.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BridgeStatisticsResponse {

    private BigInteger totalLocked;
    private BigInteger totalReleased;
    private BigInteger totalRefunded;
    private BigInteger totalPending;
    private BigInteger feesCollected;
    private BigInteger feePoolBalance;
    private BigInteger insuranceFundBalance;
    private Map<BridgeTransactionStatus, Long> transactionsByStatus;
    private long activeValidators;
    /** Completed share of finished transfers, in percent. */
    private double successRate;
    private Double averageCompletionSeconds;
    private long stuckTransactions;
    private List<ChainStatisticsResponse> chains;
}
