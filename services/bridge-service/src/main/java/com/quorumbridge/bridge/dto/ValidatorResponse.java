package com.quorumbridge.bridge.dto;

import com.quorumbridge.bridge.domain.Validator;
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
public class ValidatorResponse {

    private String address;
    private BigInteger stake;
    private Integer reputation;
    /** Reputation after decay up to the time of the request. */
    private Integer effectiveReputation;
    private boolean active;
    private boolean eligible;
    private Integer slashCount;
    private Long validatedTransactions;
    private Instant lastActivityAt;
    private Instant registeredAt;
    private Instant deactivatedAt;
    private String deactivationReason;

    public static ValidatorResponse from(Validator validator, int effectiveReputation, boolean eligible) {
        return ValidatorResponse.builder()
                .address(validator.getAddress())
                .stake(validator.getStake())
                .reputation(validator.getReputation())
                .effectiveReputation(effectiveReputation)
                .active(validator.isActive())
                .eligible(eligible)
                .slashCount(validator.getSlashCount())
                .validatedTransactions(validator.getValidatedTransactions())
                .lastActivityAt(validator.getLastActivityAt())
                .registeredAt(validator.getRegisteredAt())
                .deactivatedAt(validator.getDeactivatedAt())
                .deactivationReason(validator.getDeactivationReason())
                .build();
    }
}
