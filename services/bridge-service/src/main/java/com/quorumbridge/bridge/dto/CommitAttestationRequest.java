package com.quorumbridge.bridge.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CommitAttestationRequest {

    @NotBlank(message = "Commitment is required")
    @Pattern(regexp = "^0x[0-9a-fA-F]{64}$", message = "Commitment must be a 32-byte hex hash")
    private String commitment;
}
