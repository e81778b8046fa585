package com.quorumbridge.bridge.service;

import com.quorumbridge.bridge.client.TokenLedgerClient;
import com.quorumbridge.bridge.client.dto.BalanceResponse;
import com.quorumbridge.bridge.client.dto.TransferRequest;
import com.quorumbridge.bridge.client.dto.TransferResult;
import com.quorumbridge.bridge.config.BridgeProperties;
import com.quorumbridge.bridge.exception.EconomicException;
import com.quorumbridge.bridge.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;

/**
 * Token movements between users and the bridge custody account.
 *
 * <p>A transfer the ledger reports as unsuccessful is a hard error; callers run inside
 * a database transaction that rolls back with it.</p>
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TokenLedger {

    private final TokenLedgerClient client;
    private final BridgeProperties properties;

    public BigInteger balanceOf(String address) {
        BalanceResponse response = client.balanceOf(address);
        if (response == null || response.getBalance() == null) {
            throw new EconomicException(ErrorCode.TOKEN_LEDGER_UNAVAILABLE,
                    "Token ledger returned no balance for " + address, true);
        }
        return response.getBalance();
    }

    /**
     * Moves {@code amount} from {@code from} into custody using the allowance granted to custody.
     */
    public void pullIntoCustody(String from, BigInteger amount, String reference) {
        if (amount.signum() == 0) {
            return;
        }
        TransferResult result = client.transferFrom(TransferRequest.builder()
                .from(from)
                .to(properties.getCustodyAddress())
                .amount(amount)
                .reference(reference)
                .build());
        requireSuccess(result, "transferFrom", from, amount, reference);
    }

    /**
     * Pays {@code amount} out of custody to {@code to}.
     */
    public void payOut(String to, BigInteger amount, String reference) {
        if (amount.signum() == 0) {
            return;
        }
        TransferResult result = client.transfer(TransferRequest.builder()
                .from(properties.getCustodyAddress())
                .to(to)
                .amount(amount)
                .reference(reference)
                .build());
        requireSuccess(result, "transfer", to, amount, reference);
    }

    private void requireSuccess(TransferResult result, String operation, String counterparty,
                                BigInteger amount, String reference) {
        if (result == null || !result.isSuccess()) {
            String reason = result == null ? "no response" : result.getMessage();
            log.warn("Token {} refused - counterparty: {}, amount: {}, reference: {}, reason: {}",
                    operation, counterparty, amount, reference, reason);
            throw new EconomicException(ErrorCode.TOKEN_TRANSFER_FAILED,
                    "Token " + operation + " failed for " + reference + ": " + reason);
        }
        log.debug("Token {} ok - counterparty: {}, amount: {}, reference: {}", operation, counterparty, amount, reference);
    }
}
