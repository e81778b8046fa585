package com.quorumbridge.bridge.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for disputing a validator's attestation
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OpenChallengeRequest {

    @NotBlank(message = "Validator address is required")
    private String validator;

    @NotNull(message = "Transaction nonce is required")
    @Positive(message = "Transaction nonce must be positive")
    private Long transactionNonce;

    @NotBlank(message = "Proof is required")
    @Size(max = 10000, message = "Proof must not exceed 10000 characters")
    private String proof;
}
