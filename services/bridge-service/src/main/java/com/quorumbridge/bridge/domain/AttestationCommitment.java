package com.quorumbridge.bridge.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Commit phase of a commit-reveal attestation. One row per (nonce, validator); an
 * expired row is reused when the validator commits again.
 */
@Entity
@Table(name = "attestation_commitments", uniqueConstraints = {
        @UniqueConstraint(name = "uk_commitment_nonce_validator",
                columnNames = {"transaction_nonce", "validator_address"})
}, indexes = {
        @Index(name = "idx_commitment_status_deadline", columnList = "status, reveal_deadline")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AttestationCommitment {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "transaction_nonce", nullable = false)
    private Long transactionNonce;

    @Column(name = "validator_address", nullable = false, length = 42)
    private String validatorAddress;

    @Column(name = "commitment", nullable = false, length = 66)
    private String commitment;

    @Column(name = "committed_at", nullable = false)
    private Instant committedAt;

    @Column(name = "reveal_deadline", nullable = false)
    private Instant revealDeadline;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private CommitmentStatus status;

    @Version
    @Column(name = "version")
    private Long version;

    /** Pending and still inside its reveal window. */
    public boolean isLive(Instant now) {
        return status == CommitmentStatus.PENDING && now.isBefore(revealDeadline);
    }
}
