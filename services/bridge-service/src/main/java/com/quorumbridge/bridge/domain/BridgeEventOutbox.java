package com.quorumbridge.bridge.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Bridge event outbox entity.
 *
 * <p>Events are written in the same database transaction as the state change they
 * describe and relayed to Kafka afterwards, so an event exists if and only if the
 * change committed.</p>
 */
@Entity
@Table(name = "bridge_event_outbox", indexes = {
        @Index(name = "idx_outbox_status_created", columnList = "status, created_at"),
        @Index(name = "idx_outbox_next_retry", columnList = "next_retry_at, status"),
        @Index(name = "idx_outbox_event_type", columnList = "event_type")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BridgeEventOutbox {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "topic", nullable = false, length = 100)
    private String topic;

    @Column(name = "event_key", nullable = false, length = 100)
    private String eventKey;

    @Column(name = "event_type", nullable = false, length = 50)
    private String eventType;

    @Column(name = "payload", nullable = false, columnDefinition = "TEXT")
    private String payload;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 30)
    private OutboxStatus status;

    @Builder.Default
    @Column(name = "retry_count", nullable = false)
    private Integer retryCount = 0;

    @Builder.Default
    @Column(name = "max_retries", nullable = false)
    private Integer maxRetries = 5;

    @Column(name = "next_retry_at")
    private Instant nextRetryAt;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "sent_at")
    private Instant sentAt;

    @Version
    @Column(name = "version")
    private Long version;

    /**
     * Increment retry count and schedule the next attempt with exponential backoff.
     *
     * @return true if another attempt is allowed, false if max retries exceeded
     */
    public boolean incrementRetryCount(Instant now) {
        this.retryCount++;

        if (this.retryCount >= this.maxRetries) {
            this.status = OutboxStatus.FAILED;
            return false;
        }

        // 2^retryCount seconds, capped at one hour
        long backoffSeconds = (long) Math.min(Math.pow(2, this.retryCount), 3600);
        this.nextRetryAt = now.plusSeconds(backoffSeconds);
        this.status = OutboxStatus.RETRY_SCHEDULED;

        return true;
    }

    public enum OutboxStatus {
        PENDING,           // Ready to send
        SENT,              // Acknowledged by Kafka
        RETRY_SCHEDULED,   // Failed but will retry
        FAILED             // Permanently failed
    }
}
