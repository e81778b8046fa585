package com.quorumbridge.bridge.domain;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Destination chain settings: availability, amount bounds and fee schedule.
 */
@Entity
@Table(name = "chain_configurations")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ChainConfiguration {

    @Id
    @Column(name = "chain_id")
    private Long chainId;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "enabled", nullable = false)
    private boolean enabled;

    @Column(name = "min_amount", nullable = false, precision = 78, scale = 0)
    private BigInteger minAmount;

    @Column(name = "max_amount", nullable = false, precision = 78, scale = 0)
    private BigInteger maxAmount;

    @Column(name = "base_fee", nullable = false, precision = 78, scale = 0)
    private BigInteger baseFee;

    @Column(name = "fee_bps", nullable = false)
    private Integer feeBps;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(name = "version")
    private Long version;
}
