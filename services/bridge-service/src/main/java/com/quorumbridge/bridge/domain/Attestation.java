package com.quorumbridge.bridge.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * One validator's accepted attestation of one transaction.
 */
@Entity
@Table(name = "bridge_attestations", uniqueConstraints = {
        @UniqueConstraint(name = "uk_attestation_nonce_validator",
                columnNames = {"transaction_nonce", "validator_address"}),
        @UniqueConstraint(name = "uk_attestation_signature_hash", columnNames = "signature_hash")
}, indexes = {
        @Index(name = "idx_attestation_validator", columnList = "validator_address")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Attestation {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "transaction_nonce", nullable = false)
    private Long transactionNonce;

    @Column(name = "validator_address", nullable = false, length = 42)
    private String validatorAddress;

    @Column(name = "signature", nullable = false, length = 132)
    private String signature;

    @Column(name = "signature_hash", nullable = false, length = 66)
    private String signatureHash;

    /** The hash that was signed: the transfer hash, or the commitment in commit-reveal mode. */
    @Column(name = "signed_hash", nullable = false, length = 66)
    private String signedHash;

    @Enumerated(EnumType.STRING)
    @Column(name = "mode", nullable = false, length = 20)
    private AttestationMode mode;

    @Column(name = "attested_at", nullable = false)
    private Instant attestedAt;

    @Builder.Default
    @Column(name = "invalidated", nullable = false)
    private boolean invalidated = false;

    @Column(name = "invalidated_at")
    private Instant invalidatedAt;
}
