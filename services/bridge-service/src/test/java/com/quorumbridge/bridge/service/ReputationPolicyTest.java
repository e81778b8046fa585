package com.quorumbridge.bridge.service;

import com.quorumbridge.bridge.config.BridgeProperties;
import com.quorumbridge.bridge.domain.Validator;
import com.quorumbridge.bridge.support.TestProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ReputationPolicy Tests")
class ReputationPolicyTest {

    private static final Instant NOW = Instant.parse("2026-03-01T00:00:00Z");

    private BridgeProperties properties;
    private ReputationPolicy policy;

    @BeforeEach
    void setUp() {
        properties = TestProperties.bridgeProperties();
        properties.getValidator().setDecayPerDay(2);
        policy = new ReputationPolicy(properties);
    }

    @Test
    @DisplayName("Should decay by whole days since last activity")
    void shouldDecayByWholeDays() {
        Instant lastActivity = NOW.minus(Duration.ofDays(10)).minus(Duration.ofHours(23));

        assertThat(policy.decayed(500, lastActivity, NOW)).isEqualTo(480);
    }

    @Test
    @DisplayName("Should never decay below zero")
    void shouldNotDecayBelowZero() {
        assertThat(policy.decayed(10, NOW.minus(Duration.ofDays(365)), NOW)).isZero();
    }

    @Test
    @DisplayName("Should clamp updates to the maximum reputation and mark activity")
    void shouldClampToMaximum() {
        // Given
        Validator validator = validator(990, NOW);

        // When
        int updated = policy.apply(validator, 50, NOW.plus(Duration.ofHours(1)));

        // Then
        assertThat(updated).isEqualTo(1000);
        assertThat(validator.getReputation()).isEqualTo(1000);
        assertThat(validator.getLastActivityAt()).isEqualTo(NOW.plus(Duration.ofHours(1)));
    }

    @Test
    @DisplayName("Should materialize decay before applying a penalty")
    void shouldDecayBeforePenalty() {
        Validator validator = validator(400, NOW.minus(Duration.ofDays(5)));

        int updated = policy.apply(validator, -100, NOW);

        assertThat(updated).isEqualTo(290);
    }

    @Test
    @DisplayName("Should lose eligibility once decayed below the validation floor")
    void shouldLoseEligibilityAfterDecay() {
        Validator validator = validator(310, NOW);

        assertThat(policy.isEligible(validator, NOW)).isTrue();
        assertThat(policy.isEligible(validator, NOW.plus(Duration.ofDays(6)))).isFalse();
    }

    @Test
    @DisplayName("Should require active status and minimum stake for eligibility")
    void shouldRequireActiveAndStaked() {
        Validator understaked = validator(600, NOW);
        understaked.setStake(BigInteger.valueOf(9_999));
        Validator inactive = validator(600, NOW);
        inactive.setActive(false);

        assertThat(policy.isEligible(understaked, NOW)).isFalse();
        assertThat(policy.isEligible(inactive, NOW)).isFalse();
    }

    private Validator validator(int reputation, Instant lastActivity) {
        return Validator.builder()
                .address("0x0000000000000000000000000000000000000001")
                .stake(BigInteger.valueOf(10_000))
                .reputation(reputation)
                .active(true)
                .lastActivityAt(lastActivity)
                .registeredAt(lastActivity)
                .build();
    }
}
