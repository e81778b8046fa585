package com.quorumbridge.bridge.domain;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigInteger;
import java.time.Instant;

@Entity
@Table(name = "challenge_votes", uniqueConstraints = {
        @UniqueConstraint(name = "uk_challenge_vote_voter", columnNames = {"challenge_id", "voter"})
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ChallengeVote {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "challenge_id", nullable = false)
    private Long challengeId;

    @Column(name = "voter", nullable = false, length = 42)
    private String voter;

    @Column(name = "supports_validator", nullable = false)
    private boolean supportsValidator;

    /** Token balance of the voter when the vote was cast. */
    @Column(name = "weight", nullable = false, precision = 78, scale = 0)
    private BigInteger weight;

    @Column(name = "voted_at", nullable = false)
    private Instant votedAt;
}
