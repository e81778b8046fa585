package com.quorumbridge.bridge.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Validator attestation. {@code salt} is only used when revealing a commitment.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AttestationRequest {

    @NotBlank(message = "Signature is required")
    @Pattern(regexp = "^0x[0-9a-fA-F]{130}$", message = "Signature must be 65 bytes of hex")
    private String signature;

    @Pattern(regexp = "^0x[0-9a-fA-F]{64}$", message = "Salt must be 32 bytes of hex")
    private String salt;
}
