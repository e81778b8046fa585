package com.quorumbridge.bridge.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "failure_votes", uniqueConstraints = {
        @UniqueConstraint(name = "uk_failure_vote_nonce_validator",
                columnNames = {"transaction_nonce", "validator_address"})
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FailureVote {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "transaction_nonce", nullable = false)
    private Long transactionNonce;

    @Column(name = "validator_address", nullable = false, length = 42)
    private String validatorAddress;

    @Column(name = "reason", nullable = false, length = 500)
    private String reason;

    @Column(name = "voted_at", nullable = false)
    private Instant votedAt;
}
