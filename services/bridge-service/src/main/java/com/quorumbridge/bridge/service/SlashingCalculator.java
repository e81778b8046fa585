package com.quorumbridge.bridge.service;

import com.quorumbridge.bridge.config.BridgeProperties;
import com.quorumbridge.bridge.crypto.TokenAmounts;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

/**
 * Splits a slash between challenger reward and insurance fund. The two shares always
 * add up to the slashed amount.
 */
@Component
@RequiredArgsConstructor
public class SlashingCalculator {

    private final BridgeProperties properties;

    public SlashOutcome calculate(BigInteger stake) {
        BridgeProperties.ChallengeProperties config = properties.getChallenge();
        int bps = Math.min(config.getSlashBps(), config.getMaxSlashBps());
        BigInteger slashed = TokenAmounts.applyBps(stake, bps).min(stake);
        BigInteger reward = TokenAmounts.applyBps(slashed, config.getChallengerRewardBps());
        return new SlashOutcome(slashed, reward, slashed.subtract(reward));
    }

    public record SlashOutcome(BigInteger slashed, BigInteger challengerReward, BigInteger insuranceShare) {
    }
}
