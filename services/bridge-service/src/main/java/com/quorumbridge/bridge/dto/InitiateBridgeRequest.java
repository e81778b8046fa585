package com.quorumbridge.bridge.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

/**
 * Request DTO for locking tokens for a cross-chain transfer
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InitiateBridgeRequest {

    @NotNull(message = "Amount is required")
    @Positive(message = "Amount must be positive")
    private BigInteger amount;

    @NotNull(message = "Destination chain is required")
    @Positive(message = "Destination chain id must be positive")
    private Long destinationChainId;
}
