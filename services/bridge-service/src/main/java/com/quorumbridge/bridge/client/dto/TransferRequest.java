package com.quorumbridge.bridge.client.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

/**
 * Transfer instruction for the token ledger. {@code from} is only set for
 * {@code transferFrom}, which spends an allowance granted to the custody account.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransferRequest {
    private String from;
    private String to;
    private BigInteger amount;
    private String reference;
}
