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
public class ChallengeVoteRequest {

    @NotNull(message = "Vote side is required")
    private Boolean supportsValidator;
}
