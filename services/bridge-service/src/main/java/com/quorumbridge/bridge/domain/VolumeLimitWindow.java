package com.quorumbridge.bridge.domain;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigInteger;

/**
 * Volume consumed in the current fixed epoch for one scope ({@code GLOBAL} or
 * {@code USER:<address>}).
 */
@Entity
@Table(name = "volume_windows")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class VolumeLimitWindow {

    public static final String GLOBAL_SCOPE = "GLOBAL";

    @Id
    @Column(name = "scope", length = 60)
    private String scope;

    @Column(name = "epoch_index", nullable = false)
    private Long epochIndex;

    @Builder.Default
    @Column(name = "used", nullable = false, precision = 78, scale = 0)
    private BigInteger used = BigInteger.ZERO;

    @Version
    @Column(name = "version")
    private Long version;

    public static String userScope(String address) {
        return "USER:" + address;
    }

    /**
     * Adds {@code amount} to the epoch's usage unless that would pass {@code limit}.
     * Usage restarts from zero when {@code currentEpoch} is past the stored epoch.
     *
     * @return false when the limit would be exceeded; usage is not increased then
     */
    public boolean tryConsume(long currentEpoch, BigInteger amount, BigInteger limit) {
        if (currentEpoch > epochIndex) {
            epochIndex = currentEpoch;
            used = BigInteger.ZERO;
        }
        BigInteger next = used.add(amount);
        if (next.compareTo(limit) > 0) {
            return false;
        }
        used = next;
        return true;
    }
}
