package com.quorumbridge.bridge.dto;

import com.quorumbridge.bridge.domain.ChallengeVote;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;
import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChallengeVoteResponse {

    private Long challengeId;
    private String voter;
    private boolean supportsValidator;
    private BigInteger weight;
    private Instant votedAt;

    public static ChallengeVoteResponse from(ChallengeVote vote) {
        return ChallengeVoteResponse.builder()
                .challengeId(vote.getChallengeId())
                .voter(vote.getVoter())
                .supportsValidator(vote.isSupportsValidator())
                .weight(vote.getWeight())
                .votedAt(vote.getVotedAt())
                .build();
    }
}
