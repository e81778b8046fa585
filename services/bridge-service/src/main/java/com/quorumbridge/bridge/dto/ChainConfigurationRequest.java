package com.quorumbridge.bridge.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

/**
 * Request DTO for adding or updating a destination chain
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChainConfigurationRequest {

    @NotNull(message = "Chain id is required")
    @Positive(message = "Chain id must be positive")
    private Long chainId;

    @NotBlank(message = "Chain name is required")
    @Size(max = 100, message = "Chain name must not exceed 100 characters")
    private String name;

    @NotNull(message = "Enabled flag is required")
    private Boolean enabled;

    @NotNull(message = "Minimum amount is required")
    @Positive(message = "Minimum amount must be positive")
    private BigInteger minAmount;

    @NotNull(message = "Maximum amount is required")
    @Positive(message = "Maximum amount must be positive")
    private BigInteger maxAmount;

    @NotNull(message = "Base fee is required")
    @PositiveOrZero(message = "Base fee must not be negative")
    private BigInteger baseFee;

    @NotNull(message = "Fee bps is required")
    @Min(value = 0, message = "Fee bps must not be negative")
    @Max(value = 10000, message = "Fee bps must not exceed 10000")
    private Integer feeBps;
}
