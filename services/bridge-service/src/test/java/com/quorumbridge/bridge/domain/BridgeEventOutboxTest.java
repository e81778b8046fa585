package com.quorumbridge.bridge.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("BridgeEventOutbox Tests")
class BridgeEventOutboxTest {

    private static final Instant NOW = Instant.parse("2026-03-01T00:00:00Z");

    @Test
    @DisplayName("Should schedule retries with exponential backoff")
    void shouldBackOffExponentially() {
        BridgeEventOutbox event = event();

        assertThat(event.incrementRetryCount(NOW)).isTrue();
        assertThat(event.getNextRetryAt()).isEqualTo(NOW.plusSeconds(2));
        assertThat(event.incrementRetryCount(NOW)).isTrue();
        assertThat(event.getNextRetryAt()).isEqualTo(NOW.plusSeconds(4));
        assertThat(event.getStatus()).isEqualTo(BridgeEventOutbox.OutboxStatus.RETRY_SCHEDULED);
    }

    @Test
    @DisplayName("Should fail permanently once retries are exhausted")
    void shouldFailAfterMaxRetries() {
        BridgeEventOutbox event = event();
        event.setRetryCount(4);

        assertThat(event.incrementRetryCount(NOW)).isFalse();
        assertThat(event.getStatus()).isEqualTo(BridgeEventOutbox.OutboxStatus.FAILED);
    }

    private BridgeEventOutbox event() {
        return BridgeEventOutbox.builder()
                .topic("bridge-transaction-events")
                .eventKey("1")
                .eventType("BRIDGE_INITIATED")
                .payload("{}")
                .status(BridgeEventOutbox.OutboxStatus.PENDING)
                .createdAt(NOW)
                .build();
    }
}
