package com.quorumbridge.bridge.service;

import com.quorumbridge.bridge.config.BridgeProperties;
import com.quorumbridge.bridge.support.TestProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SlashingCalculator Tests")
class SlashingCalculatorTest {

    private BridgeProperties properties;
    private SlashingCalculator calculator;

    @BeforeEach
    void setUp() {
        properties = TestProperties.bridgeProperties();
        properties.getChallenge().setSlashBps(1_000);
        properties.getChallenge().setMaxSlashBps(2_000);
        properties.getChallenge().setChallengerRewardBps(5_000);
        calculator = new SlashingCalculator(properties);
    }

    @Test
    @DisplayName("Should slash ten percent and split it evenly")
    void shouldSplitSlash() {
        SlashingCalculator.SlashOutcome outcome = calculator.calculate(BigInteger.valueOf(10_000));

        assertThat(outcome.slashed()).isEqualTo(BigInteger.valueOf(1_000));
        assertThat(outcome.challengerReward()).isEqualTo(BigInteger.valueOf(500));
        assertThat(outcome.insuranceShare()).isEqualTo(BigInteger.valueOf(500));
    }

    @Test
    @DisplayName("Should cap the slash rate at the maximum")
    void shouldCapSlashRate() {
        properties.getChallenge().setSlashBps(5_000);

        SlashingCalculator.SlashOutcome outcome = calculator.calculate(BigInteger.valueOf(10_000));

        assertThat(outcome.slashed()).isEqualTo(BigInteger.valueOf(2_000));
    }

    @Test
    @DisplayName("Should give rounding remainder to insurance so shares add up")
    void shouldConserveSlashedAmount() {
        properties.getChallenge().setChallengerRewardBps(3_333);

        SlashingCalculator.SlashOutcome outcome = calculator.calculate(BigInteger.valueOf(10_007));

        assertThat(outcome.slashed()).isEqualTo(BigInteger.valueOf(1_000));
        assertThat(outcome.challengerReward()).isEqualTo(BigInteger.valueOf(333));
        assertThat(outcome.challengerReward().add(outcome.insuranceShare())).isEqualTo(outcome.slashed());
    }

    @Test
    @DisplayName("Should slash nothing from an empty stake")
    void shouldHandleEmptyStake() {
        SlashingCalculator.SlashOutcome outcome = calculator.calculate(BigInteger.ZERO);

        assertThat(outcome.slashed()).isZero();
        assertThat(outcome.insuranceShare()).isZero();
    }
}
