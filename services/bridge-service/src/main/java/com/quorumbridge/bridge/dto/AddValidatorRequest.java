package com.quorumbridge.bridge.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AddValidatorRequest {

    @NotBlank(message = "Validator address is required")
    private String address;

    @NotNull(message = "Stake is required")
    @Positive(message = "Stake must be positive")
    private BigInteger stake;
}
