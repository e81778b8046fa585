package com.quorumbridge.bridge.domain;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Balance held in custody for one reserve purpose.
 */
@Entity
@Table(name = "reserve_funds", uniqueConstraints = {
        @UniqueConstraint(name = "uk_reserve_fund_type", columnNames = "fund_type")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ReserveFund {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "fund_type", nullable = false, length = 20)
    private ReserveFundType fundType;

    @Builder.Default
    @Column(name = "balance", nullable = false, precision = 78, scale = 0)
    private BigInteger balance = BigInteger.ZERO;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Version
    @Column(name = "version")
    private Long version;
}
