package com.quorumbridge.bridge.domain;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Dispute against one validator's attestation of one transaction.
 */
@Entity
@Table(name = "bridge_challenges", indexes = {
        @Index(name = "idx_challenge_status", columnList = "status"),
        @Index(name = "idx_challenge_validator_status", columnList = "validator_address, status"),
        @Index(name = "idx_challenge_nonce", columnList = "transaction_nonce")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Challenge {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "challenger", nullable = false, length = 42)
    private String challenger;

    @Column(name = "validator_address", nullable = false, length = 42)
    private String validatorAddress;

    @Column(name = "transaction_nonce", nullable = false)
    private Long transactionNonce;

    @Column(name = "proof", nullable = false, columnDefinition = "TEXT")
    private String proof;

    @Column(name = "stake", nullable = false, precision = 78, scale = 0)
    private BigInteger stake;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "deadline", nullable = false)
    private Instant deadline;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private ChallengeStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "resolution_method", length = 20)
    private ResolutionMethod resolutionMethod;

    @Column(name = "resolved_by", length = 42)
    private String resolvedBy;

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    @Builder.Default
    @Column(name = "slashed_amount", nullable = false, precision = 78, scale = 0)
    private BigInteger slashedAmount = BigInteger.ZERO;

    @Builder.Default
    @Column(name = "challenger_reward", nullable = false, precision = 78, scale = 0)
    private BigInteger challengerReward = BigInteger.ZERO;

    @Builder.Default
    @Column(name = "insurance_share", nullable = false, precision = 78, scale = 0)
    private BigInteger insuranceShare = BigInteger.ZERO;

    @Builder.Default
    @Column(name = "votes_for_validator", nullable = false, precision = 78, scale = 0)
    private BigInteger votesForValidator = BigInteger.ZERO;

    @Builder.Default
    @Column(name = "votes_against_validator", nullable = false, precision = 78, scale = 0)
    private BigInteger votesAgainstValidator = BigInteger.ZERO;

    @Version
    @Column(name = "version")
    private Long version;

    public boolean isOpen() {
        return status == ChallengeStatus.OPEN;
    }

    public BigInteger totalVoteWeight() {
        return votesForValidator.add(votesAgainstValidator);
    }
}
