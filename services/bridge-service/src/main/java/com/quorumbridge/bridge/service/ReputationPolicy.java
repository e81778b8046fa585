package com.quorumbridge.bridge.service;

import com.quorumbridge.bridge.config.BridgeProperties;
import com.quorumbridge.bridge.domain.Validator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Reputation arithmetic on the single bounded scale {@code [0, maxReputation]}.
 *
 * <p>Decay is lazy and linear: {@code decayPerDay} points per whole day since the
 * validator's last activity, never below zero. It is materialized only when the
 * reputation is next updated.</p>
 */
@Component
@RequiredArgsConstructor
public class ReputationPolicy {

    private final BridgeProperties properties;

    public int effectiveReputation(Validator validator, Instant now) {
        return decayed(validator.getReputation(), validator.getLastActivityAt(), now);
    }

    int decayed(int reputation, Instant lastActivityAt, Instant now) {
        long days = lastActivityAt == null || now.isBefore(lastActivityAt)
                ? 0
                : Duration.between(lastActivityAt, now).toDays();
        long decay = days * properties.getValidator().getDecayPerDay();
        return (int) Math.max(0L, reputation - decay);
    }

    /**
     * Applies decay, then {@code delta}, clamps, and marks the validator active now.
     *
     * @return the new stored reputation
     */
    public int apply(Validator validator, int delta, Instant now) {
        long next = (long) effectiveReputation(validator, now) + delta;
        int clamped = (int) Math.max(0L, Math.min(properties.getValidator().getMaxReputation(), next));
        validator.setReputation(clamped);
        validator.setLastActivityAt(now);
        return clamped;
    }

    /**
     * Active, sufficiently staked and trusted enough to count toward quorum.
     */
    public boolean isEligible(Validator validator, Instant now) {
        BridgeProperties.ValidatorProperties config = properties.getValidator();
        return validator.isActive()
                && validator.getStake().compareTo(config.getMinStake()) >= 0
                && effectiveReputation(validator, now) >= config.getMinReputationToValidate();
    }
}
