package com.quorumbridge.bridge.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeeQuoteResponse {

    private Long destinationChainId;
    private BigInteger amount;
    private BigInteger fee;
    /** Amount plus fee: what initiation pulls from the user. */
    private BigInteger totalLocked;
}
