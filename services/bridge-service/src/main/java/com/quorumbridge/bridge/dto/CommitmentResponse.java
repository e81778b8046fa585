package com.quorumbridge.bridge.dto;

import com.quorumbridge.bridge.domain.AttestationCommitment;
import com.quorumbridge.bridge.domain.CommitmentStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CommitmentResponse {

    private Long transactionNonce;
    private String validator;
    private String commitment;
    private Instant committedAt;
    private Instant revealDeadline;
    private CommitmentStatus status;

    public static CommitmentResponse from(AttestationCommitment commitment) {
        return CommitmentResponse.builder()
                .transactionNonce(commitment.getTransactionNonce())
                .validator(commitment.getValidatorAddress())
                .commitment(commitment.getCommitment())
                .committedAt(commitment.getCommittedAt())
                .revealDeadline(commitment.getRevealDeadline())
                .status(commitment.getStatus())
                .build();
    }
}
