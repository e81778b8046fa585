package com.quorumbridge.bridge.dto;

import com.quorumbridge.bridge.domain.Attestation;
import com.quorumbridge.bridge.domain.AttestationMode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AttestationResponse {

    private Long transactionNonce;
    private String validator;
    private String signature;
    private String signedHash;
    private AttestationMode mode;
    private Instant attestedAt;
    private boolean invalidated;

    public static AttestationResponse from(Attestation attestation) {
        return AttestationResponse.builder()
                .transactionNonce(attestation.getTransactionNonce())
                .validator(attestation.getValidatorAddress())
                .signature(attestation.getSignature())
                .signedHash(attestation.getSignedHash())
                .mode(attestation.getMode())
                .attestedAt(attestation.getAttestedAt())
                .invalidated(attestation.isInvalidated())
                .build();
    }
}
