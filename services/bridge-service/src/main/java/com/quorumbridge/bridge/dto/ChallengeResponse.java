package com.quorumbridge.bridge.dto;

import com.quorumbridge.bridge.domain.Challenge;
import com.quorumbridge.bridge.domain.ChallengeStatus;
import com.quorumbridge.bridge.domain.ResolutionMethod;
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
public class ChallengeResponse {

    private Long id;
    private String challenger;
    private String validator;
    private Long transactionNonce;
    private String proof;
    private BigInteger stake;
    private Instant createdAt;
    private Instant deadline;
    private ChallengeStatus status;
    private ResolutionMethod resolutionMethod;
    private String resolvedBy;
    private Instant resolvedAt;
    private BigInteger slashedAmount;
    private BigInteger challengerReward;
    private BigInteger insuranceShare;
    private BigInteger votesForValidator;
    private BigInteger votesAgainstValidator;

    public static ChallengeResponse from(Challenge challenge) {
        return ChallengeResponse.builder()
                .id(challenge.getId())
                .challenger(challenge.getChallenger())
                .validator(challenge.getValidatorAddress())
                .transactionNonce(challenge.getTransactionNonce())
                .proof(challenge.getProof())
                .stake(challenge.getStake())
                .createdAt(challenge.getCreatedAt())
                .deadline(challenge.getDeadline())
                .status(challenge.getStatus())
                .resolutionMethod(challenge.getResolutionMethod())
                .resolvedBy(challenge.getResolvedBy())
                .resolvedAt(challenge.getResolvedAt())
                .slashedAmount(challenge.getSlashedAmount())
                .challengerReward(challenge.getChallengerReward())
                .insuranceShare(challenge.getInsuranceShare())
                .votesForValidator(challenge.getVotesForValidator())
                .votesAgainstValidator(challenge.getVotesAgainstValidator())
                .build();
    }
}
