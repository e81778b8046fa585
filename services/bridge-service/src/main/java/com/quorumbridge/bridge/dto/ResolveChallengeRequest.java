package com.quorumbridge.bridge.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResolveChallengeRequest {

    /** True upholds the challenge and slashes the validator. */
    @NotNull(message = "Outcome is required")
    private Boolean successful;
}
