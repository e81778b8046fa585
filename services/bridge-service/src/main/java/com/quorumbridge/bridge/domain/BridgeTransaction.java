package com.quorumbridge.bridge.domain;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigInteger;
import java.time.Instant;

/**
 * A locked cross-chain transfer awaiting validator attestation.
 */
@Entity
@Table(name = "bridge_transactions", indexes = {
        @Index(name = "idx_bridge_tx_status", columnList = "status"),
        @Index(name = "idx_bridge_tx_user", columnList = "user_address"),
        @Index(name = "idx_bridge_tx_created", columnList = "created_at"),
        @Index(name = "idx_bridge_tx_destination", columnList = "destination_chain_id, status")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BridgeTransaction {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "nonce")
    private Long nonce;

    @Column(name = "user_address", nullable = false, length = 42)
    private String userAddress;

    @Column(name = "amount", nullable = false, precision = 78, scale = 0)
    private BigInteger amount;

    @Column(name = "fee", nullable = false, precision = 78, scale = 0)
    private BigInteger fee;

    @Column(name = "source_chain_id", nullable = false)
    private Long sourceChainId;

    @Column(name = "destination_chain_id", nullable = false)
    private Long destinationChainId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private BridgeTransactionStatus status;

    @Builder.Default
    @Column(name = "attestation_count", nullable = false)
    private Integer attestationCount = 0;

    @Builder.Default
    @Column(name = "failure_vote_count", nullable = false)
    private Integer failureVoteCount = 0;

    @Column(name = "message_hash", length = 66)
    private String messageHash;

    @Column(name = "destination_proof_hash", length = 66)
    private String destinationProofHash;

    @Column(name = "failure_reason", length = 500)
    private String failureReason;

    /** Set when a challenge against one of the completing attestations was upheld. */
    @Builder.Default
    @Column(name = "trust_revoked", nullable = false)
    private boolean trustRevoked = false;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    /** Time from initiation to quorum, set on completion. */
    @Column(name = "completion_millis")
    private Long completionMillis;

    @Column(name = "refunded_at")
    private Instant refundedAt;

    @Version
    @Column(name = "version")
    private Long version;

    /** Locked principal plus fee. */
    public BigInteger lockedTotal() {
        return amount.add(fee);
    }

    public boolean isPending() {
        return status == BridgeTransactionStatus.PENDING;
    }
}
