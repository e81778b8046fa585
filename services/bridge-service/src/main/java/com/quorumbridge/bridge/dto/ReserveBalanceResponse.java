package com.quorumbridge.bridge.dto;

import com.quorumbridge.bridge.domain.ReserveFundType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReserveBalanceResponse {

    private ReserveFundType fund;
    private BigInteger balance;
}
