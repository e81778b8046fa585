package com.quorumbridge.bridge.dto;

import com.quorumbridge.bridge.domain.ChainConfiguration;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;
import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChainConfigurationResponse {

    private Long chainId;
    private String name;
    private boolean enabled;
    private BigInteger minAmount;
    private BigInteger maxAmount;
    private BigInteger baseFee;
    private Integer feeBps;
    private Instant updatedAt;

    public static ChainConfigurationResponse from(ChainConfiguration chain) {
        return ChainConfigurationResponse.builder()
                .chainId(chain.getChainId())
                .name(chain.getName())
                .enabled(chain.isEnabled())
                .minAmount(chain.getMinAmount())
                .maxAmount(chain.getMaxAmount())
                .baseFee(chain.getBaseFee())
                .feeBps(chain.getFeeBps())
                .updatedAt(chain.getUpdatedAt())
                .build();
    }
}
