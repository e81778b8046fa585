package com.quorumbridge.bridge.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

/**
 * Volume and settlement figures for one destination chain.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChainStatisticsResponse {

    private Long chainId;
    private long transactions;
    private long completed;
    private long failed;
    private long cancelled;
    private long pending;
    private BigInteger volume;
    private BigInteger fees;
    /** Completed share of finished transfers, in percent; zero until one finishes. */
    private double successRate;
    /** Mean initiation-to-completion time; null until one completes. */
    private Double averageCompletionSeconds;
}
