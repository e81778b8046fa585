package com.quorumbridge.bridge.dto;

import com.quorumbridge.bridge.domain.BridgeTransaction;
import com.quorumbridge.bridge.domain.BridgeTransactionStatus;
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
public class BridgeTransactionResponse {

    private Long nonce;
    private String user;
    private BigInteger amount;
    private BigInteger fee;
    private Long sourceChainId;
    private Long destinationChainId;
    private BridgeTransactionStatus status;
    private Integer attestationCount;
    private Integer failureVoteCount;
    private String messageHash;
    private String destinationProofHash;
    private String failureReason;
    private boolean trustRevoked;
    private Instant createdAt;
    private Instant completedAt;
    private Instant refundedAt;

    public static BridgeTransactionResponse from(BridgeTransaction tx) {
        return BridgeTransactionResponse.builder()
                .nonce(tx.getNonce())
                .user(tx.getUserAddress())
                .amount(tx.getAmount())
                .fee(tx.getFee())
                .sourceChainId(tx.getSourceChainId())
                .destinationChainId(tx.getDestinationChainId())
                .status(tx.getStatus())
                .attestationCount(tx.getAttestationCount())
                .failureVoteCount(tx.getFailureVoteCount())
                .messageHash(tx.getMessageHash())
                .destinationProofHash(tx.getDestinationProofHash())
                .failureReason(tx.getFailureReason())
                .trustRevoked(tx.isTrustRevoked())
                .createdAt(tx.getCreatedAt())
                .completedAt(tx.getCompletedAt())
                .refundedAt(tx.getRefundedAt())
                .build();
    }
}
