package com.quorumbridge.bridge.domain;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Staked validator. Rows are never deleted; removal and slashing only deactivate.
 *
 * <p>An inactive validator with a positive stake still has stake held in custody
 * until its open challenges are settled.</p>
 */
@Entity
@Table(name = "bridge_validators", indexes = {
        @Index(name = "idx_validator_active", columnList = "active")
}, uniqueConstraints = {
        @UniqueConstraint(name = "uk_validator_address", columnNames = "address")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Validator {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "address", nullable = false, length = 42)
    private String address;

    @Column(name = "stake", nullable = false, precision = 78, scale = 0)
    private BigInteger stake;

    /** Stored value; the effective value is this minus lazy decay since {@link #lastActivityAt}. */
    @Column(name = "reputation", nullable = false)
    private Integer reputation;

    @Column(name = "active", nullable = false)
    private boolean active;

    @Builder.Default
    @Column(name = "slash_count", nullable = false)
    private Integer slashCount = 0;

    @Builder.Default
    @Column(name = "validated_transactions", nullable = false)
    private Long validatedTransactions = 0L;

    @Column(name = "last_activity_at", nullable = false)
    private Instant lastActivityAt;

    @Column(name = "registered_at", nullable = false)
    private Instant registeredAt;

    @Column(name = "deactivated_at")
    private Instant deactivatedAt;

    @Column(name = "deactivation_reason", length = 500)
    private String deactivationReason;

    @Version
    @Column(name = "version")
    private Long version;

    public void deactivate(String reason, Instant at) {
        this.active = false;
        this.deactivationReason = reason;
        this.deactivatedAt = at;
    }
}
